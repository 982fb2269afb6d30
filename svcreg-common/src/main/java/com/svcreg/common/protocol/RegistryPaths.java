/**
 * 注册中心HTTP路径，服务端与客户端共用
 *
 * @author zhenglin
 * @date 2026/10/12
 */
package com.svcreg.common.protocol;

/**
 * 注册中心HTTP路径，服务端与客户端共用
 */
public final class RegistryPaths {

    public static final String REGISTER = "/register";
    public static final String SERVICES = "/services";
    public static final String SERVICE = "/services/{name}";
    public static final String HEARTBEAT = "/heartbeat/{name}";
    public static final String HEALTH = "/health";

    public static final String REQUEST_ID_HEADER = "x-request-id";

    private RegistryPaths() {
    }
}
