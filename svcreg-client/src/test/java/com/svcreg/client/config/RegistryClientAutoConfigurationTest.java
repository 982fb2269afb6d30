/**
 * 客户端自动配置条件测试
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client.config;

import com.svcreg.client.RestTemplateServiceRegistryClient;
import com.svcreg.client.ServiceRegistryClient;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * 客户端自动配置条件测试
 */
class RegistryClientAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(RegistryClientAutoConfiguration.class));

    @Test
    void testInactiveWithoutRegistryUrl() {
        contextRunner.run(context -> {
            assertTrue(context.getBeansOfType(ServiceRegistryClient.class).isEmpty());
            assertTrue(context.getBeansOfType(RegistryClientLifecycle.class).isEmpty());
        });
    }

    @Test
    void testServiceNameFallsBackToApplicationName() {
        contextRunner
            .withPropertyValues(
                "svcreg.client.registry-url=http://registry:3000",
                "svcreg.client.service-url=http://orders:8080",
                "svcreg.client.auto-register=false",
                "spring.application.name=orders")
            .run(context -> {
                RestTemplateServiceRegistryClient client =
                    (RestTemplateServiceRegistryClient) context.getBean(ServiceRegistryClient.class);
                assertEquals("orders", client.getOptions().getServiceName());
                assertEquals("http://registry:3000", client.getOptions().getRegistryUrl());
                assertTrue(context.getBeansOfType(RegistryClientLifecycle.class).isEmpty());
            });
    }

    @Test
    void testBindsClientProperties() {
        contextRunner
            .withPropertyValues(
                "svcreg.client.registry-url=http://registry:3000",
                "svcreg.client.service-name=billing",
                "svcreg.client.service-url=http://billing:8080",
                "svcreg.client.health-check-url=http://billing:8080/health",
                "svcreg.client.metadata.region=eu",
                "svcreg.client.heartbeat-interval=10s",
                "svcreg.client.connect-timeout=2s",
                "svcreg.client.auto-register=false",
                "spring.application.name=ignored")
            .run(context -> {
                RestTemplateServiceRegistryClient client =
                    (RestTemplateServiceRegistryClient) context.getBean(ServiceRegistryClient.class);
                assertEquals("billing", client.getOptions().getServiceName());
                assertEquals("http://billing:8080/health", client.getOptions().getHealthCheckUrl());
                assertEquals("eu", client.getOptions().getMetadata().get("region"));
                assertEquals(Duration.ofSeconds(10), client.getOptions().getHeartbeatInterval());
                assertEquals(Duration.ofSeconds(2), client.getOptions().getConnectTimeout());
                assertEquals(Duration.ofSeconds(5), client.getOptions().getReadTimeout());
            });
    }

    @Test
    void testMissingServiceUrlFailsStartup() {
        contextRunner
            .withPropertyValues(
                "svcreg.client.registry-url=http://registry:3000",
                "spring.application.name=orders")
            .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void testLifecycleRegisteredByDefault() {
        contextRunner
            .withPropertyValues(
                "svcreg.client.registry-url=http://localhost:1",
                "svcreg.client.service-url=http://orders:8080",
                "svcreg.client.connect-timeout=200ms",
                "spring.application.name=orders")
            .run(context -> {
                assertEquals(1, context.getBeansOfType(RegistryClientLifecycle.class).size());
                // 注册中心不可达时应用照常启动
                assertNull(context.getStartupFailure());
                assertFalse(context.getBean(ServiceRegistryClient.class).isRegistered());
            });
    }

    @Test
    void testBacksOffForUserDefinedClient() {
        contextRunner
            .withUserConfiguration(CustomClientConfiguration.class)
            .withPropertyValues(
                "svcreg.client.registry-url=http://registry:3000",
                "svcreg.client.auto-register=false")
            .run(context -> assertSame(CustomClientConfiguration.CLIENT, context.getBean(ServiceRegistryClient.class)));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomClientConfiguration {

        static final ServiceRegistryClient CLIENT = mock(ServiceRegistryClient.class);

        @Bean
        ServiceRegistryClient customClient() {
            return CLIENT;
        }
    }
}
