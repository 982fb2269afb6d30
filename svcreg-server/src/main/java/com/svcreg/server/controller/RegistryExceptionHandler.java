/**
 * 统一错误应答 {error, message}
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.controller;

import com.svcreg.common.error.ErrorCode;
import com.svcreg.common.model.ErrorResponse;
import com.svcreg.server.exception.RegistryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * 统一错误应答 {error, message}
 * Spring MVC标准异常（405、415等）沿用父类的状态码处理
 */
@Slf4j
@RestControllerAdvice
public class RegistryExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistryException(RegistryException ex) {
        ErrorCode code = ex.getErrorCode();
        if (code.getHttpStatus() >= 500) {
            log.error("Registry operation failed: {}", ex.getMessage(), ex);
        } else {
            log.warn("Registry request rejected: code={}, message={}", code.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(code.getHttpStatus()).body(ErrorResponse.of(code, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity.internalServerError()
            .body(ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR, "An unexpected error occurred"));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers,
                                                                  HttpStatus status,
                                                                  WebRequest request) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(ErrorCode.BAD_REQUEST, "Malformed JSON request body"));
    }
}
