/**
 * 随应用上下文启动注册、停止注销
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client.config;

import com.svcreg.client.RegistryResult;
import com.svcreg.client.ServiceRegistryClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * 随应用上下文启动注册、停止注销
 * 注册失败只记录日志，不阻止应用启动
 */
@Slf4j
public class RegistryClientLifecycle implements SmartLifecycle {

    /**
     * 在Web服务器启动之后注册，在其停止之前注销
     */
    static final int PHASE = Integer.MAX_VALUE - 512;

    private final ServiceRegistryClient client;
    private volatile boolean running;

    public RegistryClientLifecycle(ServiceRegistryClient client) {
        this.client = client;
    }

    @Override
    public void start() {
        RegistryResult<Void> result = client.register();
        if (result.isFailure()) {
            log.warn("Service registration failed, continuing without registry: {}", result.getMessage());
        }
        running = true;
    }

    @Override
    public void stop() {
        RegistryResult<Void> result = client.unregister();
        if (result.isFailure()) {
            log.warn("Service unregistration failed: {}", result.getMessage());
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
