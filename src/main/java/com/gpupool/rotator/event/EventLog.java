package com.gpupool.rotator.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 事件历史与聚合计数
 * <p>
 * 内存环形缓冲，满了丢弃最旧的；计数器不受缓冲容量影响
 */
public class EventLog {

    public static final int DEFAULT_CAPACITY = 500;

    private final BlockingQueue<PoolEvent> recentEvents;
    private final Map<PoolEventType, Long> countsByType = new EnumMap<>(PoolEventType.class);
    private final Map<Severity, Long> countsBySeverity = new EnumMap<>(Severity.class);
    private long total;

    public EventLog() {
        this(DEFAULT_CAPACITY);
    }

    public EventLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("事件缓冲容量必须大于 0: " + capacity);
        }
        this.recentEvents = new ArrayBlockingQueue<>(capacity);
    }

    public synchronized void append(PoolEvent event) {
        if (!recentEvents.offer(event)) {
            recentEvents.poll();
            recentEvents.offer(event);
        }
        countsByType.merge(event.type(), 1L, Long::sum);
        countsBySeverity.merge(event.severity(), 1L, Long::sum);
        total++;
    }

    /**
     * 最近 n 条事件，新的在前
     */
    public synchronized List<PoolEvent> recent(int n) {
        List<PoolEvent> all = new ArrayList<>(recentEvents);
        Collections.reverse(all);
        return all.size() <= n ? all : new ArrayList<>(all.subList(0, Math.max(0, n)));
    }

    public synchronized long count(PoolEventType type) {
        return countsByType.getOrDefault(type, 0L);
    }

    public synchronized Map<PoolEventType, Long> countsByType() {
        return Collections.unmodifiableMap(new EnumMap<>(countsByType));
    }

    public synchronized Map<Severity, Long> countsBySeverity() {
        return Collections.unmodifiableMap(new EnumMap<>(countsBySeverity));
    }

    public synchronized long total() {
        return total;
    }

    public synchronized int size() {
        return recentEvents.size();
    }
}
