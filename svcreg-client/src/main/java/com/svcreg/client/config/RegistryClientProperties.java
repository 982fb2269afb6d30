/**
 * 注册中心客户端配置 - Spring Boot配置绑定
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client.config;

import com.svcreg.client.RegistryClientOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 注册中心客户端配置 - Spring Boot配置绑定
 */
@Data
@ConfigurationProperties(prefix = "svcreg.client")
public class RegistryClientProperties {

    /**
     * 注册中心地址，未配置时不启用客户端
     */
    private String registryUrl;

    /**
     * 本服务名称，未配置时使用spring.application.name
     */
    private String serviceName;

    private String serviceUrl;

    private String healthCheckUrl;

    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Duration heartbeatInterval = RegistryClientOptions.DEFAULT_HEARTBEAT_INTERVAL;

    private Duration connectTimeout = RegistryClientOptions.DEFAULT_TIMEOUT;

    private Duration readTimeout = RegistryClientOptions.DEFAULT_TIMEOUT;

    /**
     * 应用启动时自动注册，停止时注销
     */
    private boolean autoRegister = true;

    public RegistryClientOptions toOptions(String fallbackServiceName) {
        String name = serviceName != null && !serviceName.isBlank() ? serviceName : fallbackServiceName;
        return RegistryClientOptions.builder()
            .registryUrl(registryUrl)
            .serviceName(name)
            .serviceUrl(serviceUrl)
            .healthCheckUrl(healthCheckUrl)
            .metadata(metadata == null ? Map.of() : new LinkedHashMap<>(metadata))
            .heartbeatInterval(heartbeatInterval)
            .connectTimeout(connectTimeout)
            .readTimeout(readTimeout)
            .build();
    }
}
