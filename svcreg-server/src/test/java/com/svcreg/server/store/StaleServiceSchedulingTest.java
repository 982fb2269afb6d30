/**
 * 清理任务由调度器自动触发
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.svcreg.server.store;

import com.svcreg.server.MutableClock;
import com.svcreg.server.TestClockConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 清理任务由调度器自动触发
 */
@SpringBootTest(properties = "svcreg.registry.sweep-interval-ms=100")
@Import(TestClockConfiguration.class)
class StaleServiceSchedulingTest {

    @Autowired
    private RegistryStore registryStore;

    @Autowired
    private MutableClock clock;

    @Test
    void testScheduledSweepEvictsStaleService() {
        registryStore.register("orders", "http://orders", null, null);
        clock.advance(Duration.ofSeconds(61));
        registryStore.register("billing", "http://billing", null, null);

        await().atMost(5, SECONDS).until(() -> registryStore.get("orders").isEmpty());

        assertTrue(registryStore.get("billing").isPresent());
    }
}
