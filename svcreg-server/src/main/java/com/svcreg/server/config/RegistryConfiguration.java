/**
 * 注册中心Bean配置
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.config;

import com.svcreg.server.store.InMemoryRegistryStore;
import com.svcreg.server.store.RegistryStore;
import com.svcreg.server.web.RequestLoggingFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;

/**
 * 注册中心Bean配置
 */
@Slf4j
@Configuration
public class RegistryConfiguration {

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryStore registryStore(Clock clock) {
        log.info("创建内存服务注册表Bean");
        return new InMemoryRegistryStore(clock);
    }

    @Bean
    public FilterRegistrationBean<RequestLoggingFilter> requestLoggingFilter() {
        FilterRegistrationBean<RequestLoggingFilter> registration =
            new FilterRegistrationBean<>(new RequestLoggingFilter("service-registry"));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
