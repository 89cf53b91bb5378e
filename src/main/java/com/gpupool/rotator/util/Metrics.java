package com.gpupool.rotator.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus 风格指标收集器
 * <p>
 * 事件计数、池状态 gauge、Provisioner 调用延迟直方图
 */
public class Metrics {

    private static final String PREFIX = "gpupool_";

    // 计数器
    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    // 瞬时值
    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();
    // 延迟直方图桶（毫秒）
    private final long[] bucketBounds = {100, 500, 1000, 5000, 10000, 30000, 60000, 120000};
    private final ConcurrentHashMap<String, long[]> histograms = new ConcurrentHashMap<>();

    /**
     * 递增计数器
     */
    public void increment(String name) {
        counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
    }

    /**
     * 获取计数器值
     */
    public long get(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public void setGauge(String name, long value) {
        gauges.computeIfAbsent(name, k -> new AtomicLong(0)).set(value);
    }

    public long gauge(String name) {
        AtomicLong gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    /**
     * 记录延迟到直方图
     */
    public void recordLatency(String name, long latencyMs) {
        long[] buckets = histograms.computeIfAbsent(name, k -> new long[bucketBounds.length + 1]);
        synchronized (buckets) {
            for (int i = 0; i < bucketBounds.length; i++) {
                if (latencyMs <= bucketBounds[i]) {
                    buckets[i]++;
                    return;
                }
            }
            buckets[bucketBounds.length]++;
        }
    }

    /**
     * 记录池事件
     */
    public void recordEvent(String eventType) {
        increment("events_total");
        increment("events_" + eventType.toLowerCase());
    }

    /**
     * 记录一次 Provisioner 调用
     */
    public void recordProvisioning(String operation, boolean success, long latencyMs) {
        increment("provisioning_" + operation.toLowerCase() + (success ? "_success" : "_failure"));
        recordLatency("provisioning_latency_ms", latencyMs);
    }

    /**
     * 输出 Prometheus 文本格式
     */
    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        // 计数器
        counters.forEach((name, value) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" counter\n");
            sb.append(PREFIX).append(name).append(" ").append(value.get()).append("\n");
        });

        gauges.forEach((name, value) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" gauge\n");
            sb.append(PREFIX).append(name).append(" ").append(value.get()).append("\n");
        });

        // 直方图
        histograms.forEach((name, buckets) -> {
            sb.append("# TYPE ").append(PREFIX).append(name).append(" histogram\n");
            long cumulative = 0;
            synchronized (buckets) {
                for (int i = 0; i < bucketBounds.length; i++) {
                    cumulative += buckets[i];
                    sb.append(PREFIX).append(name).append("_bucket{le=\"")
                            .append(bucketBounds[i]).append("\"} ").append(cumulative).append("\n");
                }
                cumulative += buckets[bucketBounds.length];
                sb.append(PREFIX).append(name).append("_bucket{le=\"+Inf\"} ").append(cumulative).append("\n");
                sb.append(PREFIX).append(name).append("_count ").append(cumulative).append("\n");
            }
        });

        return sb.toString();
    }
}
