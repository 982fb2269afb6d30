/**
 * 错误应答：{error, message}
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.svcreg.common.error.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 错误应答：{error, message}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorResponse {

    private String error;

    private String message;

    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(code.getCode(), message);
    }
}
