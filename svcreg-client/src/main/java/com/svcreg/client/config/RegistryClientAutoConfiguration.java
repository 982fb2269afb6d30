/**
 * 注册中心客户端自动配置
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client.config;

import com.svcreg.client.RestTemplateServiceRegistryClient;
import com.svcreg.client.ServiceRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * 注册中心客户端自动配置
 * 配置了svcreg.client.registry-url时生效
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "svcreg.client", name = "registry-url")
@EnableConfigurationProperties(RegistryClientProperties.class)
public class RegistryClientAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(ServiceRegistryClient.class)
    public ServiceRegistryClient serviceRegistryClient(RegistryClientProperties properties, Environment environment) {
        String applicationName = environment.getProperty("spring.application.name");
        RestTemplateServiceRegistryClient client =
            new RestTemplateServiceRegistryClient(properties.toOptions(applicationName));
        log.info("Service registry client configured: registry={}, service={}",
            properties.getRegistryUrl(), client.getOptions().getServiceName());
        return client;
    }

    @Bean
    @ConditionalOnProperty(prefix = "svcreg.client", name = "auto-register", havingValue = "true", matchIfMissing = true)
    public RegistryClientLifecycle registryClientLifecycle(ServiceRegistryClient client) {
        return new RegistryClientLifecycle(client);
    }
}
