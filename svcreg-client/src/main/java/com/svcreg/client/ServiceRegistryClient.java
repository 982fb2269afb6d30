/**
 * 服务注册中心客户端
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client;

import com.svcreg.common.model.HealthResponse;
import com.svcreg.common.model.ServiceRecord;

import java.util.Map;

/**
 * 服务注册中心客户端
 * 所有方法都不抛出异常，失败通过 {@link RegistryResult} 返回
 */
public interface ServiceRegistryClient extends AutoCloseable {

    /**
     * 注册本服务，成功后启动心跳定时任务
     */
    RegistryResult<Void> register();

    /**
     * 发送一次心跳
     */
    RegistryResult<Void> sendHeartbeat();

    /**
     * 按名称查询服务，未注册时返回404失败结果
     */
    RegistryResult<ServiceRecord> discover(String serviceName);

    RegistryResult<Map<String, ServiceRecord>> listAll();

    /**
     * 更新本服务的注册信息，为null的参数保持不变
     */
    RegistryResult<Void> update(String serviceUrl, String healthCheckUrl, Map<String, Object> metadata);

    RegistryResult<HealthResponse> checkHealth();

    /**
     * 停止心跳并注销本服务；未注册时直接返回成功，可重复调用
     */
    RegistryResult<Void> unregister();

    boolean isRegistered();

    @Override
    void close();
}
