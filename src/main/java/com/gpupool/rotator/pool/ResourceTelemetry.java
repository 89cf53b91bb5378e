package com.gpupool.rotator.pool;

/**
 * 运行中节点的资源遥测
 *
 * @param gpuName            GPU 型号
 * @param memoryUsedGb       已用显存
 * @param memoryTotalGb      总显存
 * @param utilizationPercent 利用率 0-100
 * @param temperatureCelsius 温度，未知时为 null
 */
public record ResourceTelemetry(String gpuName, double memoryUsedGb, double memoryTotalGb,
                                double utilizationPercent, Double temperatureCelsius) {

    public double memoryFreeGb() {
        return Math.max(0, memoryTotalGb - memoryUsedGb);
    }
}
