package com.gpupool.rotator.provision;

import com.gpupool.rotator.pool.ResourceTelemetry;

/**
 * Provisioner 调用结果
 *
 * @param fatal     失败且不值得重试（认证失效、账号被封等），直接挂起账号
 * @param telemetry 成功时的资源遥测，可为 null
 */
public record ProvisionResult(boolean success, String message, boolean fatal, ResourceTelemetry telemetry) {

    public static ProvisionResult ok() {
        return new ProvisionResult(true, "ok", false, null);
    }

    public static ProvisionResult ok(ResourceTelemetry telemetry) {
        return new ProvisionResult(true, "ok", false, telemetry);
    }

    public static ProvisionResult failure(String message) {
        return new ProvisionResult(false, message, false, null);
    }

    public static ProvisionResult fatal(String message) {
        return new ProvisionResult(false, message, true, null);
    }
}
