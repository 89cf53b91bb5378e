package com.gpupool.rotator.controller;

import com.alibaba.fastjson2.JSONObject;
import com.gpupool.rotator.scheduler.PoolStatus;
import com.gpupool.rotator.scheduler.RotationScheduler;
import com.gpupool.rotator.scheduler.TickDriver;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final RotationScheduler scheduler;
    private final TickDriver tickDriver;

    public HealthController(RotationScheduler scheduler, TickDriver tickDriver) {
        this.scheduler = scheduler;
        this.tickDriver = tickDriver;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        PoolStatus status = scheduler.getPoolStatus();
        JSONObject result = new JSONObject();
        result.put("status", status.poolAvailable() ? "ok" : "degraded");
        result.put("version", "1.0.0");
        result.put("accounts", JSONObject.of( //
                "total", status.total(), //
                "available", status.available(), //
                "cooldown", status.cooldown() //
        ));
        result.put("sessionActive", status.currentSession() != null);
        result.put("tickerRunning", tickDriver.isRunning());
        result.put("ticks", tickDriver.tickCount());
        return Mono.just(result.toJSONString());
    }
}
