/**
 * 过期服务清理任务
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.store;

import com.svcreg.server.config.RegistryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 过期服务清理任务
 * 周期性移除长时间未心跳的服务，不通知被移除方
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleServiceSweeper {

    private final RegistryStore registryStore;
    private final RegistryProperties properties;

    @Scheduled(fixedRateString = "#{@registryProperties.sweepIntervalMs}",
        initialDelayString = "#{@registryProperties.sweepIntervalMs}")
    public void sweep() {
        try {
            int removed = registryStore.removeStaleServices(properties.getStaleAfterSeconds());
            if (removed > 0) {
                log.info("Stale sweep removed {} service(s), {} remaining", removed, registryStore.count());
            } else {
                log.debug("Stale sweep found nothing to remove, {} registered", registryStore.count());
            }
        } catch (Exception e) {
            // 调度任务抛出异常会终止后续执行
            log.error("Stale sweep failed", e);
        }
    }
}
