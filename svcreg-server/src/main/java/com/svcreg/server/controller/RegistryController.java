/**
 * 服务注册/发现REST接口
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.controller;

import com.svcreg.common.model.RegisterRequest;
import com.svcreg.common.model.ServiceRecord;
import com.svcreg.common.model.StatusResponse;
import com.svcreg.common.model.UpdateRequest;
import com.svcreg.common.protocol.RegistryPaths;
import com.svcreg.server.exception.InvalidRegistrationException;
import com.svcreg.server.exception.ServiceNotFoundException;
import com.svcreg.server.exception.UpdateFailedException;
import com.svcreg.server.store.RegistryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

/**
 * 服务注册/发现REST接口
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class RegistryController {

    private final RegistryStore registryStore;
    private final Clock clock;

    @PostMapping(RegistryPaths.REGISTER)
    public ResponseEntity<StatusResponse> register(@RequestBody(required = false) RegisterRequest request) {
        if (request == null || !StringUtils.hasText(request.getName()) || !StringUtils.hasText(request.getUrl())) {
            throw new InvalidRegistrationException("Service name and URL are required");
        }
        registryStore.register(request.getName(), request.getUrl(), request.getHealthCheckUrl(), request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(status(StatusResponse.REGISTERED));
    }

    @PutMapping(RegistryPaths.SERVICE)
    public ResponseEntity<StatusResponse> update(@PathVariable("name") String name,
                                                 @RequestBody(required = false) UpdateRequest request) {
        if (request != null && request.getUrl() != null && !StringUtils.hasText(request.getUrl())) {
            throw new InvalidRegistrationException("Service URL must not be blank");
        }
        if (registryStore.get(name).isEmpty()) {
            throw new ServiceNotFoundException(name);
        }
        if (!registryStore.update(name, request)) {
            throw new UpdateFailedException(name);
        }
        return ResponseEntity.ok(status(StatusResponse.UPDATED));
    }

    @DeleteMapping(RegistryPaths.SERVICE)
    public ResponseEntity<StatusResponse> delete(@PathVariable("name") String name) {
        if (!registryStore.delete(name)) {
            throw new ServiceNotFoundException(name);
        }
        return ResponseEntity.ok(status(StatusResponse.DELETED));
    }

    @PostMapping(RegistryPaths.HEARTBEAT)
    public ResponseEntity<StatusResponse> heartbeat(@PathVariable("name") String name) {
        if (!registryStore.recordHeartbeat(name)) {
            throw new ServiceNotFoundException(name);
        }
        return ResponseEntity.ok(status(StatusResponse.OK));
    }

    @GetMapping(RegistryPaths.SERVICE)
    public ResponseEntity<ServiceRecord> get(@PathVariable("name") String name) {
        return registryStore.get(name)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new ServiceNotFoundException(name));
    }

    @GetMapping(RegistryPaths.SERVICES)
    public ResponseEntity<Map<String, ServiceRecord>> list() {
        return ResponseEntity.ok(registryStore.getAll());
    }

    private StatusResponse status(String status) {
        return StatusResponse.of(status, clock.instant());
    }
}
