/**
 * 服务注册记录
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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务注册记录
 * 每个服务名对应一条记录，由注册中心独占维护
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceRecord {

    /**
     * 服务名（注册表主键）
     */
    private String name;

    /**
     * 服务访问地址
     */
    private String url;

    /**
     * 健康检查地址（可选）
     */
    private String healthCheckUrl;

    /**
     * 自定义元数据，更新时整体替换
     */
    private Map<String, Object> metadata;

    /**
     * 最后一次心跳时间（epoch毫秒）
     */
    private long lastHeartbeat;

    /**
     * 深拷贝元数据，避免调用方持有注册表内部引用
     */
    public ServiceRecord copy() {
        return toBuilder()
            .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
            .build();
    }
}
