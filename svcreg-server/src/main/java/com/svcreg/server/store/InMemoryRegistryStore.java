/**
 * 轻量内存服务注册表
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.store;

import com.svcreg.common.model.ServiceRecord;
import com.svcreg.common.model.UpdateRequest;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 轻量内存服务注册表
 * 记录按服务名整条替换，读操作只返回拷贝
 */
@Slf4j
public class InMemoryRegistryStore implements RegistryStore {

    // serviceName -> record
    private final ConcurrentMap<String, ServiceRecord> services;

    private final Clock clock;

    public InMemoryRegistryStore(Clock clock) {
        this(clock, new ConcurrentHashMap<>());
    }

    InMemoryRegistryStore(Clock clock, ConcurrentMap<String, ServiceRecord> services) {
        this.clock = clock;
        this.services = services;
    }

    @Override
    public void register(String name, String url, String healthCheckUrl, Map<String, Object> metadata) {
        if (name == null || name.isBlank() || url == null || url.isBlank()) {
            throw new IllegalArgumentException("Service name and URL are required");
        }
        ServiceRecord record = ServiceRecord.builder()
            .name(name)
            .url(url)
            .healthCheckUrl(healthCheckUrl)
            .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
            .lastHeartbeat(clock.millis())
            .build();
        ServiceRecord previous = services.put(name, record);
        log.info("Service registered: name={}, url={}, replaced={}", name, url, previous != null);
    }

    @Override
    public boolean update(String name, UpdateRequest patch) {
        if (patch != null && patch.getUrl() != null && patch.getUrl().isBlank()) {
            throw new IllegalArgumentException("Service URL must not be blank");
        }
        ServiceRecord updated = services.computeIfPresent(name, (k, existing) -> {
            ServiceRecord.ServiceRecordBuilder b = existing.toBuilder().lastHeartbeat(clock.millis());
            if (patch != null) {
                if (patch.getUrl() != null) {
                    b.url(patch.getUrl());
                }
                if (patch.getHealthCheckUrl() != null) {
                    b.healthCheckUrl(patch.getHealthCheckUrl());
                }
                if (patch.getMetadata() != null) {
                    b.metadata(new LinkedHashMap<>(patch.getMetadata()));
                }
            }
            return b.build();
        });
        if (updated != null) {
            log.info("Service updated: name={}, url={}", name, updated.getUrl());
        }
        return updated != null;
    }

    @Override
    public Optional<ServiceRecord> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ServiceRecord record = services.get(name);
        return Optional.ofNullable(record == null ? null : record.copy());
    }

    @Override
    public Map<String, ServiceRecord> getAll() {
        Map<String, ServiceRecord> snapshot = new TreeMap<>();
        services.forEach((name, record) -> snapshot.put(name, record.copy()));
        return snapshot;
    }

    @Override
    public boolean recordHeartbeat(String name) {
        if (name == null) {
            return false;
        }
        long now = clock.millis();
        ServiceRecord updated = services.computeIfPresent(name,
            (k, existing) -> existing.toBuilder().lastHeartbeat(now).build());
        if (updated != null) {
            log.debug("Heartbeat recorded: name={}", name);
        }
        return updated != null;
    }

    @Override
    public boolean delete(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = services.remove(name) != null;
        if (removed) {
            log.info("Service deleted: name={}", name);
        }
        return removed;
    }

    @Override
    public int removeStaleServices(long maxAgeSeconds) {
        long threshold = clock.millis() - maxAgeSeconds * 1000L;
        int removed = 0;
        for (Map.Entry<String, ServiceRecord> entry : services.entrySet()) {
            ServiceRecord record = entry.getValue();
            // 只移除读到的那条记录，期间有心跳替换过的不受影响
            if (record.getLastHeartbeat() < threshold && services.remove(entry.getKey(), record)) {
                removed++;
                log.info("Stale service removed: name={}, lastHeartbeat={}", entry.getKey(), record.getLastHeartbeat());
            }
        }
        return removed;
    }

    @Override
    public int count() {
        return services.size();
    }
}
