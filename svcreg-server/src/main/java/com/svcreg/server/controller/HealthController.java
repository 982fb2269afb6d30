/**
 * 健康检查接口
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.controller;

import com.svcreg.common.model.HealthResponse;
import com.svcreg.common.model.StatusResponse;
import com.svcreg.common.protocol.RegistryPaths;
import com.svcreg.server.config.RegistryProperties;
import com.svcreg.server.store.RegistryStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final RegistryStore registryStore;
    private final RegistryProperties properties;
    private final Clock clock;

    @GetMapping(RegistryPaths.HEALTH)
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.builder()
            .status(StatusResponse.OK)
            .version(properties.getVersion())
            .timestamp(clock.instant().toString())
            .services(registryStore.count())
            .build());
    }
}
