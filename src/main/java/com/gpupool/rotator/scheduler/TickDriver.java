package com.gpupool.rotator.scheduler;

import com.gpupool.rotator.config.AppProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 周期 tick 驱动
 * <p>
 * 可在运行时暂停/恢复；暂停和关闭时保存账号池
 */
@Component
public class TickDriver {

    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    private final RotationScheduler scheduler;
    private final AtomicBoolean running;
    private final AtomicLong ticks = new AtomicLong();

    public TickDriver(RotationScheduler scheduler, AppProperties properties) {
        this.scheduler = scheduler;
        this.running = new AtomicBoolean(properties.getTick().isAutoStart());
    }

    /**
     * 固定间隔（上一次结束后开始计时）
     */
    @Scheduled(fixedDelayString = "${pool.tick.interval-ms:10000}", initialDelay = 1000)
    public void onTick() {
        if (!running.get()) {
            return;
        }
        try {
            scheduler.tick();
            ticks.incrementAndGet();
        } catch (Exception e) {
            log.error("tick 执行失败", e);
        }
    }

    public boolean start() {
        boolean changed = running.compareAndSet(false, true);
        if (changed) {
            log.info("tick 已恢复");
        }
        return changed;
    }

    public boolean stop() {
        boolean changed = running.compareAndSet(true, false);
        if (changed) {
            scheduler.save();
            log.info("tick 已暂停, 账号池已保存");
        }
        return changed;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long tickCount() {
        return ticks.get();
    }

    @PreDestroy
    public void shutdown() {
        running.set(false);
        scheduler.save();
        log.info("服务关闭, 账号池已保存");
    }
}
