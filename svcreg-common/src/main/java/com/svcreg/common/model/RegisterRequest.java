/**
 * 服务注册请求 POST /register
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 服务注册请求 POST /register
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegisterRequest {

    private String name;

    private String url;

    private String healthCheckUrl;

    private Map<String, Object> metadata;
}
