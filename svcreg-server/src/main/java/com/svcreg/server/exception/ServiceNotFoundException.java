/**
 * 服务未注册异常
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.exception;

import com.svcreg.common.error.ErrorCode;

public class ServiceNotFoundException extends RegistryException {

    private final String serviceName;

    public ServiceNotFoundException(String serviceName) {
        super(ErrorCode.NOT_FOUND, "Service '" + serviceName + "' not found");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
