/**
 * 注册请求参数异常
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.exception;

import com.svcreg.common.error.ErrorCode;

public class InvalidRegistrationException extends RegistryException {

    public InvalidRegistrationException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }
}
