/**
 * 注册中心错误码
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.error;

import java.util.Arrays;
import java.util.Optional;

/**
 * 注册中心错误码
 */
public enum ErrorCode {

    /**
     * 缺少必填字段或请求体无法解析
     */
    BAD_REQUEST("bad_request", 400),

    /**
     * 目标服务未注册
     */
    NOT_FOUND("not_found", 404),

    /**
     * 更新过程中记录被并发删除
     */
    UPDATE_FAILED("update_failed", 500),

    /**
     * 未预期的服务端异常
     */
    INTERNAL_SERVER_ERROR("internal_server_error", 500);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values()).filter(c -> c.code.equals(code)).findFirst();
    }
}
