/**
 * 注册中心业务异常基类，携带对外错误码
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.exception;

import com.svcreg.common.error.ErrorCode;

/**
 * 注册中心业务异常基类，携带对外错误码
 */
public class RegistryException extends RuntimeException {

    private final ErrorCode errorCode;

    public RegistryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
