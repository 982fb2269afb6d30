/**
 * 写操作的通用应答：{status, timestamp}
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 写操作的通用应答：{status, timestamp}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusResponse {

    public static final String REGISTERED = "registered";
    public static final String UPDATED = "updated";
    public static final String OK = "ok";
    public static final String DELETED = "deleted";

    private String status;

    /**
     * ISO-8601时间戳
     */
    private String timestamp;

    public static StatusResponse of(String status, Instant at) {
        return new StatusResponse(status, at.toString());
    }
}
