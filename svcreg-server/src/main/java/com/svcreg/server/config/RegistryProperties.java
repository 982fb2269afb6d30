/**
 * 注册中心配置
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 注册中心配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "svcreg.registry")
public class RegistryProperties {

    /**
     * 健康检查接口返回的版本号
     */
    private String version = "1.0.0";

    /**
     * 超过该秒数未心跳的服务将被清理
     */
    private long staleAfterSeconds = 60;

    /**
     * 清理任务执行间隔（毫秒）
     */
    private long sweepIntervalMs = 30000;
}
