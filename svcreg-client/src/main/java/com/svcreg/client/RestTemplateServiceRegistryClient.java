/**
 * 基于Spring RestTemplate的注册中心客户端
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client;

import com.svcreg.common.model.HealthResponse;
import com.svcreg.common.model.RegisterRequest;
import com.svcreg.common.model.ServiceRecord;
import com.svcreg.common.model.StatusResponse;
import com.svcreg.common.model.UpdateRequest;
import com.svcreg.common.protocol.RegistryPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 基于Spring RestTemplate的注册中心客户端
 * 负责注册、定时心跳、服务发现与注销
 */
@Slf4j
public class RestTemplateServiceRegistryClient implements ServiceRegistryClient {

    private static final ParameterizedTypeReference<Map<String, ServiceRecord>> SERVICE_MAP_TYPE =
        new ParameterizedTypeReference<Map<String, ServiceRecord>>() {};

    private final RegistryClientOptions options;
    private final RestTemplate restTemplate;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean registered = new AtomicBoolean(false);
    private ScheduledFuture<?> heartbeatTask;

    public RestTemplateServiceRegistryClient(RegistryClientOptions options) {
        this(options, createRestTemplate(validate(options)));
    }

    public RestTemplateServiceRegistryClient(RegistryClientOptions options, RestTemplate restTemplate) {
        this.options = validate(options);
        this.restTemplate = restTemplate;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "svcreg-heartbeat-" + options.getServiceName());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 所有出站请求都受连接/读取超时约束
     */
    static RestTemplate createRestTemplate(RegistryClientOptions options) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) options.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) options.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }

    private static RegistryClientOptions validate(RegistryClientOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Registry client options are required");
        }
        if (!StringUtils.hasText(options.getRegistryUrl())) {
            throw new IllegalArgumentException("registryUrl is required");
        }
        if (!StringUtils.hasText(options.getServiceName())) {
            throw new IllegalArgumentException("serviceName is required");
        }
        if (!StringUtils.hasText(options.getServiceUrl())) {
            throw new IllegalArgumentException("serviceUrl is required");
        }
        if (options.getHeartbeatInterval() == null || options.getHeartbeatInterval().isNegative()
            || options.getHeartbeatInterval().isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (options.getConnectTimeout() == null || options.getReadTimeout() == null) {
            throw new IllegalArgumentException("connectTimeout and readTimeout are required");
        }
        // 提前校验地址格式
        UriComponentsBuilder.fromHttpUrl(options.getRegistryUrl());
        return options;
    }

    @Override
    public RegistryResult<Void> register() {
        if (scheduler.isShutdown()) {
            log.warn("Registration skipped, client already closed: name={}", options.getServiceName());
            return RegistryResult.failure("Registry client is closed", null);
        }
        RegisterRequest body = RegisterRequest.builder()
            .name(options.getServiceName())
            .url(options.getServiceUrl())
            .healthCheckUrl(options.getHealthCheckUrl())
            .metadata(options.getMetadata() == null ? Collections.emptyMap() : options.getMetadata())
            .build();

        RegistryResult<Void> result = call("register with Service Registry", () ->
            restTemplate.exchange(uri(RegistryPaths.REGISTER), HttpMethod.POST,
                new HttpEntity<>(body, jsonHeaders()), StatusResponse.class));

        if (result.isSuccess()) {
            registered.set(true);
            startHeartbeat();
            log.info("Registered with Service Registry: name={}, url={}, registry={}",
                options.getServiceName(), options.getServiceUrl(), options.getRegistryUrl());
        }
        return result;
    }

    @Override
    public RegistryResult<Void> sendHeartbeat() {
        RegistryResult<Void> result = call("send heartbeat to Service Registry", () ->
            restTemplate.exchange(uri(RegistryPaths.HEARTBEAT, options.getServiceName()), HttpMethod.POST,
                new HttpEntity<>(jsonHeaders()), StatusResponse.class));
        if (result.isSuccess()) {
            log.debug("Heartbeat sent: name={}", options.getServiceName());
        }
        return result;
    }

    @Override
    public RegistryResult<ServiceRecord> discover(String serviceName) {
        if (!StringUtils.hasText(serviceName)) {
            return RegistryResult.failure("Service name is required", null);
        }
        return fetch("discover service '" + serviceName + "'", () ->
            restTemplate.exchange(uri(RegistryPaths.SERVICE, serviceName), HttpMethod.GET,
                new HttpEntity<>(jsonHeaders()), ServiceRecord.class));
    }

    @Override
    public RegistryResult<Map<String, ServiceRecord>> listAll() {
        RegistryResult<Map<String, ServiceRecord>> result = fetch("list services", () ->
            restTemplate.exchange(uri(RegistryPaths.SERVICES), HttpMethod.GET,
                new HttpEntity<>(jsonHeaders()), SERVICE_MAP_TYPE));
        if (result.isSuccess() && result.getValue().isEmpty()) {
            return RegistryResult.success(new LinkedHashMap<>());
        }
        return result;
    }

    @Override
    public RegistryResult<Void> update(String serviceUrl, String healthCheckUrl, Map<String, Object> metadata) {
        UpdateRequest body = UpdateRequest.builder()
            .url(serviceUrl)
            .healthCheckUrl(healthCheckUrl)
            .metadata(metadata)
            .build();
        return call("update registration", () ->
            restTemplate.exchange(uri(RegistryPaths.SERVICE, options.getServiceName()), HttpMethod.PUT,
                new HttpEntity<>(body, jsonHeaders()), StatusResponse.class));
    }

    @Override
    public RegistryResult<HealthResponse> checkHealth() {
        return fetch("check Service Registry health", () ->
            restTemplate.exchange(uri(RegistryPaths.HEALTH), HttpMethod.GET,
                new HttpEntity<>(jsonHeaders()), HealthResponse.class));
    }

    @Override
    public RegistryResult<Void> unregister() {
        stopHeartbeat();

        if (!registered.get()) {
            return RegistryResult.success(null);
        }

        RegistryResult<Void> result = call("unregister from Service Registry", () ->
            restTemplate.exchange(uri(RegistryPaths.SERVICE, options.getServiceName()), HttpMethod.DELETE,
                new HttpEntity<>(jsonHeaders()), StatusResponse.class));

        // 注册中心已应答（无论状态码）即视为已注销；网络失败时保留注册状态以便重试
        if (result.isSuccess() || result.getStatusCode().isPresent()) {
            registered.set(false);
        }
        if (result.isSuccess()) {
            log.info("Unregistered from Service Registry: name={}", options.getServiceName());
        }
        return result;
    }

    @Override
    public boolean isRegistered() {
        return registered.get();
    }

    @Override
    public void close() {
        unregister();
        scheduler.shutdownNow();
    }

    public RegistryClientOptions getOptions() {
        return options;
    }

    synchronized boolean isHeartbeatActive() {
        return heartbeatTask != null && !heartbeatTask.isDone();
    }

    private synchronized void startHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
        }
        long intervalMs = options.getHeartbeatInterval().toMillis();
        try {
            // sendHeartbeat不抛异常，失败后定时任务继续执行
            heartbeatTask = scheduler.scheduleAtFixedRate(this::sendHeartbeat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            heartbeatTask = null;
            log.warn("Heartbeat not started, client already closed: name={}", options.getServiceName());
        }
    }

    private synchronized void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    /**
     * 只关心状态码的调用
     */
    private RegistryResult<Void> call(String action, Supplier<ResponseEntity<?>> request) {
        RegistryResult<Object> result = execute(action, request);
        return result.map(ignored -> null);
    }

    /**
     * 需要应答体的调用
     */
    private <T> RegistryResult<T> fetch(String action, Supplier<ResponseEntity<T>> request) {
        return execute(action, request);
    }

    @SuppressWarnings("unchecked")
    private <T> RegistryResult<T> execute(String action, Supplier<? extends ResponseEntity<?>> request) {
        try {
            ResponseEntity<?> response = request.get();
            if (!response.getStatusCode().is2xxSuccessful()) {
                log.warn("Failed to {}: HTTP {}", action, response.getStatusCodeValue());
                return RegistryResult.failure(response.getStatusCodeValue(), "HTTP " + response.getStatusCodeValue(), null);
            }
            return RegistryResult.success((T) response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getRawStatusCode();
            if (status == 404) {
                log.warn("Failed to {}: not found", action);
            } else {
                log.warn("Failed to {}: HTTP {} {}", action, status, e.getResponseBodyAsString());
            }
            return RegistryResult.failure(status, "HTTP " + status, e);
        } catch (Exception e) {
            log.error("Failed to {}: {}", action, e.getMessage(), e);
            return RegistryResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    private URI uri(String path, Object... uriVariables) {
        return UriComponentsBuilder.fromHttpUrl(options.getRegistryUrl())
            .path(path)
            .buildAndExpand(uriVariables)
            .encode()
            .toUri();
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
