/**
 * 服务注册表接口（进程内存储，无持久化）
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.store;

import com.svcreg.common.model.ServiceRecord;
import com.svcreg.common.model.UpdateRequest;

import java.util.Map;
import java.util.Optional;

/**
 * 服务注册表接口（进程内存储，无持久化）
 */
public interface RegistryStore {

    /**
     * 默认的过期阈值（秒）
     */
    long DEFAULT_MAX_AGE_SECONDS = 60;

    /**
     * 注册服务，同名记录整体覆盖
     */
    void register(String name, String url, String healthCheckUrl, Map<String, Object> metadata);

    /**
     * 部分更新已注册的服务
     *
     * @return 服务不存在时返回false
     */
    boolean update(String name, UpdateRequest patch);

    Optional<ServiceRecord> get(String name);

    /**
     * @return 全量快照（拷贝）
     */
    Map<String, ServiceRecord> getAll();

    boolean recordHeartbeat(String name);

    boolean delete(String name);

    /**
     * 移除超过maxAgeSeconds未心跳的服务
     *
     * @return 被移除的服务数量
     */
    int removeStaleServices(long maxAgeSeconds);

    default int removeStaleServices() {
        return removeStaleServices(DEFAULT_MAX_AGE_SECONDS);
    }

    int count();
}
