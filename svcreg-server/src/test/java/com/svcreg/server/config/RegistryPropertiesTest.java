/**
 * 配置绑定测试
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.svcreg.server.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置绑定测试
 */
@SpringBootTest(properties = {
    "svcreg.registry.version=2.3.4",
    "svcreg.registry.stale-after-seconds=120",
    "svcreg.registry.sweep-interval-ms=3600000"
})
class RegistryPropertiesTest {

    @Autowired
    private RegistryProperties properties;

    @Test
    void testBindsProperties() {
        assertEquals("2.3.4", properties.getVersion());
        assertEquals(120, properties.getStaleAfterSeconds());
        assertEquals(3_600_000L, properties.getSweepIntervalMs());
    }

    @Test
    void testDefaults() {
        RegistryProperties defaults = new RegistryProperties();

        assertEquals("1.0.0", defaults.getVersion());
        assertEquals(60, defaults.getStaleAfterSeconds());
        assertEquals(30_000L, defaults.getSweepIntervalMs());
    }
}
