/**
 * 注册中心调用结果
 *
 * @author zhenglin
 * @date 2026/10/16
 */
package com.svcreg.client;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * 注册中心调用结果
 * 客户端不向调用方抛出异常，失败信息（状态码、原因）通过结果对象返回
 *
 * @param <T> 成功时的返回值类型
 */
public final class RegistryResult<T> {

    private static final int NO_STATUS = -1;

    private final boolean success;
    private final T value;
    private final String message;
    private final int statusCode;
    private final Throwable cause;

    private RegistryResult(boolean success, T value, String message, int statusCode, Throwable cause) {
        this.success = success;
        this.value = value;
        this.message = message;
        this.statusCode = statusCode;
        this.cause = cause;
    }

    public static <T> RegistryResult<T> success(T value) {
        return new RegistryResult<>(true, value, null, NO_STATUS, null);
    }

    /**
     * 注册中心返回了非2xx应答
     */
    public static <T> RegistryResult<T> failure(int statusCode, String message, Throwable cause) {
        return new RegistryResult<>(false, null, message, statusCode, cause);
    }

    /**
     * 网络不可达、超时或应答无法解析
     */
    public static <T> RegistryResult<T> failure(String message, Throwable cause) {
        return new RegistryResult<>(false, null, message, NO_STATUS, cause);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * 注册中心明确返回404
     */
    public boolean isNotFound() {
        return statusCode == 404;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public T orElse(T other) {
        return success && value != null ? value : other;
    }

    public String getMessage() {
        return message;
    }

    public OptionalInt getStatusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public <R> RegistryResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return new RegistryResult<>(false, null, message, statusCode, cause);
        }
        return success(value == null ? null : mapper.apply(value));
    }

    @Override
    public String toString() {
        if (success) {
            return "RegistryResult{success, value=" + value + '}';
        }
        return "RegistryResult{failure, status=" + (statusCode == NO_STATUS ? "n/a" : statusCode)
            + ", message=" + message + '}';
    }
}
