/**
 * 注册中心客户端配置
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * 注册中心客户端配置
 */
@Value
@Builder(toBuilder = true)
public class RegistryClientOptions {

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * 注册中心地址，如 http://service-registry:3000
     */
    String registryUrl;

    /**
     * 本服务名称
     */
    String serviceName;

    /**
     * 本服务对外地址
     */
    String serviceUrl;

    String healthCheckUrl;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @Builder.Default
    Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;

    @Builder.Default
    Duration connectTimeout = DEFAULT_TIMEOUT;

    @Builder.Default
    Duration readTimeout = DEFAULT_TIMEOUT;
}
