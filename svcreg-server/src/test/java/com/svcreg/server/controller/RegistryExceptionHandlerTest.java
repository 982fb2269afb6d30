/**
 * 存储层异常到错误应答的转换
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.svcreg.server.controller;

import com.svcreg.common.model.ServiceRecord;
import com.svcreg.common.model.UpdateRequest;
import com.svcreg.server.TestClockConfiguration;
import com.svcreg.server.store.RegistryStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 存储层异常到错误应答的转换
 */
@WebMvcTest(controllers = RegistryController.class)
@Import(TestClockConfiguration.class)
class RegistryExceptionHandlerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegistryStore registryStore;

    @Test
    void testUpdateLostToConcurrentDelete() throws Exception {
        // 存在性检查通过后记录被清理
        when(registryStore.get("orders"))
            .thenReturn(Optional.of(ServiceRecord.builder().name("orders").url("http://orders").build()));
        when(registryStore.update(eq("orders"), any(UpdateRequest.class))).thenReturn(false);

        mockMvc.perform(put("/services/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"http://new\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("update_failed"))
            .andExpect(jsonPath("$.message").value("Failed to update service 'orders'"));
    }

    @Test
    void testUnexpectedExceptionIsInternalServerError() throws Exception {
        when(registryStore.getAll()).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/services"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("internal_server_error"))
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    @Test
    void testUnsupportedMethodKeepsFrameworkStatus() throws Exception {
        mockMvc.perform(patch("/services/orders"))
            .andExpect(status().isMethodNotAllowed());
    }
}
