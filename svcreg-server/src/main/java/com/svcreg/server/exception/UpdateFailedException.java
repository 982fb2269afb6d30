/**
 * 存在性检查通过后记录被删除或清理，更新未生效
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.exception;

import com.svcreg.common.error.ErrorCode;

/**
 * 存在性检查通过后记录被删除或清理，更新未生效
 */
public class UpdateFailedException extends RegistryException {

    public UpdateFailedException(String serviceName) {
        super(ErrorCode.UPDATE_FAILED, "Failed to update service '" + serviceName + "'");
    }
}
