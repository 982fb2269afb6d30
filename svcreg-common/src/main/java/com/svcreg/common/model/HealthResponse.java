/**
 * 健康检查应答 GET /health
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 健康检查应答 GET /health
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthResponse {

    private String status;

    private String version;

    private String timestamp;

    /**
     * 当前注册的服务数量
     */
    private int services;
}
