package com.gpupool.rotator.controller;

import com.alibaba.fastjson2.JSONObject;
import com.gpupool.rotator.config.AppProperties;
import com.gpupool.rotator.exception.PoolExhaustedException;
import com.gpupool.rotator.exception.ValidationException;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.scheduler.RotationScheduler;
import com.gpupool.rotator.scheduler.SessionInfo;
import com.gpupool.rotator.scheduler.TickDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * 账号池管理 API
 */
@RestController
@RequestMapping(value = "/api/pool", produces = MediaType.APPLICATION_JSON_VALUE)
public class PoolController {

    private static final Logger log = LoggerFactory.getLogger(PoolController.class);
    private static final int MAX_EVENTS = 500;

    private final RotationScheduler scheduler;
    private final TickDriver tickDriver;
    private final AppProperties properties;

    public PoolController(RotationScheduler scheduler, TickDriver tickDriver, AppProperties properties) {
        this.scheduler = scheduler;
        this.tickDriver = tickDriver;
        this.properties = properties;
    }

    // ==================== 查询 ====================

    @GetMapping("/status")
    public Mono<String> status() {
        return Mono.fromCallable(() ->
                PoolJson.status(scheduler.getPoolStatus(), tickDriver.isRunning()).toJSONString());
    }

    @GetMapping("/accounts")
    public Mono<String> listAccounts() {
        return Mono.fromCallable(() -> PoolJson.accounts(scheduler.getAllAccounts()).toJSONString());
    }

    @GetMapping("/accounts/{id}")
    public Mono<String> getAccount(@PathVariable String id) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.getAccount(id)).toJSONString());
    }

    @GetMapping("/settings")
    public Mono<String> getSettings() {
        return Mono.fromCallable(() -> PoolJson.settings(scheduler.getSettings()).toJSONString());
    }

    @GetMapping("/stats")
    public Mono<String> stats() {
        return Mono.fromCallable(() -> PoolJson.stats(scheduler.getStats()).toJSONString());
    }

    @GetMapping("/events")
    public Mono<String> recentEvents(@RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> {
            if (limit < 1 || limit > MAX_EVENTS) {
                throw new ValidationException("limit 必须在 1-" + MAX_EVENTS + " 之间");
            }
            return PoolJson.events(scheduler.getRecentEvents(limit)).toJSONString();
        });
    }

    /**
     * 当前会话，只读；没有会话返回 503，获取会话走 POST /session/start
     */
    @GetMapping("/session")
    public Mono<String> session() {
        return Mono.fromCallable(() -> {
            SessionInfo session = scheduler.currentSession().orElseThrow(PoolExhaustedException::new);
            return PoolJson.session(session).toJSONString();
        });
    }

    // ==================== 账号管理 ====================

    @PostMapping("/accounts")
    public Mono<String> addAccount(@RequestBody String body) {
        return Mono.fromCallable(() -> {
            AccountSnapshot added = scheduler.addAccount(PoolJson.toSpec(null, PoolJson.parse(body)));
            return PoolJson.account(added).toJSONString();
        });
    }

    @PutMapping("/accounts/{id}")
    public Mono<String> updateAccount(@PathVariable String id, @RequestBody String body) {
        return Mono.fromCallable(() -> {
            AccountSnapshot updated = scheduler.updateAccount(PoolJson.toSpec(id, PoolJson.parse(body)));
            return PoolJson.account(updated).toJSONString();
        });
    }

    @DeleteMapping("/accounts/{id}")
    public Mono<String> removeAccount(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            scheduler.removeAccount(id);
            return JSONObject.of("success", true).toJSONString();
        });
    }

    @PutMapping("/settings")
    public Mono<String> updateSettings(@RequestBody String body) {
        return Mono.fromCallable(() -> {
            PoolSettings settings = PoolJson.toSettings(PoolJson.parse(body), scheduler.getSettings());
            return PoolJson.settings(scheduler.updateSettings(settings)).toJSONString();
        });
    }

    // ==================== 账号操作 ====================

    @PostMapping("/accounts/{id}/activate")
    public Mono<String> activate(@PathVariable String id, @RequestParam(defaultValue = "false") boolean force) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.setActive(id, force)).toJSONString());
    }

    /**
     * 恢复前同步做健康检查，放到弹性线程池避免阻塞事件循环
     */
    @PostMapping("/accounts/{id}/recover")
    public Mono<String> recover(@PathVariable String id, @RequestParam(defaultValue = "false") boolean force) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.recoverAccount(id, force)).toJSONString())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/accounts/{id}/pause")
    public Mono<String> pause(@PathVariable String id) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.pauseAccount(id)).toJSONString());
    }

    @PostMapping("/accounts/{id}/resume")
    public Mono<String> resume(@PathVariable String id) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.resumeAccount(id)).toJSONString());
    }

    @PostMapping("/accounts/{id}/reset-quota")
    public Mono<String> resetQuota(@PathVariable String id) {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.resetDailyQuota(id)).toJSONString());
    }

    @PostMapping("/accounts/{id}/tasks/started")
    public Mono<String> taskStarted(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            scheduler.recordTaskStarted(id);
            return JSONObject.of("success", true).toJSONString();
        });
    }

    /**
     * 请求体：{"success": true|false, "message": "..."}
     */
    @PostMapping("/accounts/{id}/tasks/result")
    public Mono<String> taskResult(@PathVariable String id, @RequestBody String body) {
        return Mono.fromCallable(() -> {
            JSONObject req = PoolJson.parse(body);
            Boolean success = req.getBoolean("success");
            if (success == null) {
                throw new ValidationException("缺少 success 字段");
            }
            AccountSnapshot a = scheduler.recordTaskResult(id, success, req.getString("message"));
            return PoolJson.account(a).toJSONString();
        });
    }

    @PostMapping("/reset-quotas")
    public Mono<String> resetAllQuotas() {
        return Mono.fromCallable(() -> JSONObject.of("reset", scheduler.resetAllDailyQuotas()).toJSONString());
    }

    // ==================== 会话 ====================

    @PostMapping("/session/start")
    public Mono<String> startSession() {
        return Mono.fromCallable(() -> {
            SessionInfo session = scheduler.startSession().orElseThrow(PoolExhaustedException::new);
            return PoolJson.session(session).toJSONString();
        });
    }

    @PostMapping("/session/end")
    public Mono<String> endSession() {
        return Mono.fromCallable(() -> {
            JSONObject result = new JSONObject();
            result.put("ended", scheduler.endSession().map(PoolJson::account).orElse(null));
            return result.toJSONString();
        });
    }

    @PostMapping("/session/restart")
    public Mono<String> restartSession() {
        return Mono.fromCallable(() -> PoolJson.account(scheduler.restartSession()).toJSONString());
    }

    @PostMapping("/prestart")
    public Mono<String> prestart() {
        return Mono.fromCallable(() -> {
            JSONObject result = new JSONObject();
            result.put("candidate", scheduler.prestartNext().map(PoolJson::account).orElse(null));
            return result.toJSONString();
        });
    }

    // ==================== tick 控制 ====================

    @PostMapping("/ticker/start")
    public Mono<String> startTicker() {
        return Mono.fromCallable(() -> {
            boolean changed = tickDriver.start();
            return JSONObject.of("running", true, "changed", changed).toJSONString();
        });
    }

    @PostMapping("/ticker/stop")
    public Mono<String> stopTicker() {
        return Mono.fromCallable(() -> {
            boolean changed = tickDriver.stop();
            return JSONObject.of("running", false, "changed", changed).toJSONString();
        });
    }

    // ==================== SSE 事件推送 ====================

    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> eventStream() {
        log.debug("新的事件流订阅");
        Duration heartbeat = Duration.ofSeconds(properties.getEvents().getHeartbeatSeconds());
        return scheduler.events()
                .map(e -> ServerSentEvent.<String>builder()
                        .id(String.valueOf(e.id()))
                        .event(e.type().name())
                        .data(PoolJson.event(e).toJSONString())
                        .build())
                .mergeWith(Flux.interval(heartbeat)
                        .map(t -> ServerSentEvent.<String>builder().comment("heartbeat").build()));
    }
}
