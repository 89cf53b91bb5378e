package com.gpupool.rotator.provision;

import java.time.Duration;

/**
 * Provisioner 调用超时
 */
public record ProvisioningTimeouts(Duration health, Duration start, Duration stop) {

    public static ProvisioningTimeouts defaults() {
        return new ProvisioningTimeouts(Duration.ofSeconds(5), Duration.ofSeconds(120), Duration.ofSeconds(30));
    }

    public Duration forKind(OperationKind kind) {
        return switch (kind) {
            case START, PRESTART -> start;
            case STOP -> stop;
            case HEALTH, RETRY, RECOVER -> health;
        };
    }
}
