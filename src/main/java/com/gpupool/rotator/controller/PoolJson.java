package com.gpupool.rotator.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.gpupool.rotator.event.PoolEvent;
import com.gpupool.rotator.exception.ValidationException;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.AccountSpec;
import com.gpupool.rotator.pool.AccountTier;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.pool.ProviderType;
import com.gpupool.rotator.pool.ResourceTelemetry;
import com.gpupool.rotator.pool.RotationStrategy;
import com.gpupool.rotator.scheduler.PoolStats;
import com.gpupool.rotator.scheduler.PoolStatus;
import com.gpupool.rotator.scheduler.SessionInfo;

import java.time.Duration;
import java.util.List;

/**
 * 请求/响应 JSON 转换
 * <p>
 * 时长字段对外以分钟（或秒）为单位，时间点为 ISO-8601 字符串
 */
final class PoolJson {

    private PoolJson() {
    }

    // ==================== 请求解析 ====================

    static JSONObject parse(String body) {
        if (body == null || body.isBlank()) {
            return new JSONObject();
        }
        try {
            JSONObject json = JSONObject.parseObject(body);
            return json != null ? json : new JSONObject();
        } catch (JSONException e) {
            throw new ValidationException("请求体不是合法 JSON: " + e.getMessage());
        }
    }

    static AccountSpec toSpec(String id, JSONObject req) {
        return new AccountSpec(
                id,
                req.getString("name"),
                req.getString("displayName"),
                parseEnum(ProviderType.class, req.getString("provider")),
                parseEnum(AccountTier.class, req.getString("tier")),
                req.getInteger("priority"),
                req.getBoolean("enabled"),
                req.getBoolean("emergency"),
                req.getString("endpoint"),
                minutes(req.getLong("dailyQuotaMinutes")),
                minutes(req.getLong("maxSessionMinutes")));
    }

    /**
     * 未给出的字段沿用当前值
     */
    static PoolSettings toSettings(JSONObject req, PoolSettings base) {
        String strategy = req.getString("strategy");
        RotationStrategy parsedStrategy = base.strategy();
        if (strategy != null) {
            try {
                parsedStrategy = RotationStrategy.fromName(strategy);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("未知的轮换策略: " + strategy);
            }
        }
        return new PoolSettings(
                parsedStrategy,
                orElse(minutes(req.getLong("cooldownMinutes")), base.cooldown()),
                req.getIntValue("lowQuotaThresholdPercent", base.lowQuotaThresholdPercent()),
                req.getBooleanValue("autoFailover", base.autoFailover()),
                req.getBooleanValue("autoRotateOnQuotaLow", base.autoRotateOnQuotaLow()),
                req.getIntValue("maxConsecutiveFailures", base.maxConsecutiveFailures()),
                orElse(seconds(req.getLong("errorRetrySeconds")), base.errorRetryDelay()),
                req.getBooleanValue("autoPrestart", base.autoPrestart()),
                orElse(minutes(req.getLong("prestartLeadMinutes")), base.prestartLeadTime()),
                orElse(seconds(req.getLong("healthCheckSeconds")), base.healthCheckInterval()));
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("未知的 " + type.getSimpleName() + ": " + value);
        }
    }

    private static Duration minutes(Long value) {
        return value != null ? Duration.ofMinutes(value) : null;
    }

    private static Duration seconds(Long value) {
        return value != null ? Duration.ofSeconds(value) : null;
    }

    private static Duration orElse(Duration value, Duration fallback) {
        return value != null ? value : fallback;
    }

    // ==================== 响应 ====================

    static JSONObject account(AccountSnapshot a) {
        JSONObject item = new JSONObject();
        item.put("id", a.id());
        item.put("name", a.name());
        item.put("displayName", a.displayName());
        item.put("provider", a.provider());
        item.put("tier", a.tier());
        item.put("priority", a.priority());
        item.put("enabled", a.enabled());
        item.put("emergency", a.emergency());
        item.put("endpoint", a.endpoint());
        item.put("status", a.status());
        item.put("dailyQuotaMinutes", a.dailyQuota().toMinutes());
        item.put("usedTodayMinutes", a.usedToday().toMinutes());
        item.put("remainingQuotaMinutes", a.remainingQuota().toMinutes());
        item.put("maxSessionMinutes", a.maxSessionTime().toMinutes());
        item.put("lastResetDay", text(a.lastResetDay()));
        item.put("cooldownUntil", text(a.cooldownUntil()));
        item.put("cooldownCause", a.cooldownCause());
        item.put("nextRetryAt", text(a.nextRetryAt()));
        item.put("lastUsedAt", text(a.lastUsedAt()));
        item.put("lastError", a.lastError());
        item.put("sessionStartTime", text(a.sessionStartTime()));
        item.put("totalSessions", a.totalSessions());
        item.put("successCount", a.successCount());
        item.put("failureCount", a.failureCount());
        item.put("consecutiveFailures", a.consecutiveFailures());
        item.put("rebootCount", a.rebootCount());
        item.put("successRate", a.successRate());
        item.put("telemetry", telemetry(a.telemetry()));
        item.put("createdAt", text(a.createdAt()));
        item.put("updatedAt", text(a.updatedAt()));
        return item;
    }

    static JSONArray accounts(List<AccountSnapshot> accounts) {
        JSONArray arr = new JSONArray();
        for (AccountSnapshot a : accounts) {
            arr.add(account(a));
        }
        return arr;
    }

    static JSONObject settings(PoolSettings s) {
        JSONObject result = new JSONObject();
        result.put("strategy", s.strategy());
        result.put("cooldownMinutes", s.cooldown().toMinutes());
        result.put("lowQuotaThresholdPercent", s.lowQuotaThresholdPercent());
        result.put("autoFailover", s.autoFailover());
        result.put("autoRotateOnQuotaLow", s.autoRotateOnQuotaLow());
        result.put("maxConsecutiveFailures", s.maxConsecutiveFailures());
        result.put("errorRetrySeconds", s.errorRetryDelay().toSeconds());
        result.put("autoPrestart", s.autoPrestart());
        result.put("prestartLeadMinutes", s.prestartLeadTime().toMinutes());
        result.put("healthCheckSeconds", s.healthCheckInterval().toSeconds());
        return result;
    }

    static JSONObject session(SessionInfo s) {
        if (s == null) {
            return null;
        }
        JSONObject result = new JSONObject();
        result.put("sessionId", s.sessionId());
        result.put("accountId", s.accountId());
        result.put("accountName", s.accountName());
        result.put("startedAt", text(s.startedAt()));
        result.put("durationMinutes", s.duration().toMinutes());
        result.put("emergency", s.emergency());
        result.put("connected", s.connected());
        result.put("timeUntilSwitchMinutes", s.timeUntilSwitch().toMinutes());
        return result;
    }

    static JSONObject status(PoolStatus s, boolean tickerRunning) {
        JSONObject result = new JSONObject();
        JSONObject accounts = new JSONObject();
        accounts.put("total", s.total());
        accounts.put("available", s.available());
        accounts.put("running", s.running());
        accounts.put("cooldown", s.cooldown());
        accounts.put("quotaExhausted", s.quotaExhausted());
        accounts.put("error", s.error());
        accounts.put("suspended", s.suspended());
        accounts.put("paused", s.paused());
        accounts.put("disabled", s.disabled());
        accounts.put("emergencyReady", s.emergencyReady());
        result.put("accounts", accounts);
        result.put("poolAvailable", s.poolAvailable());
        result.put("engaged", s.engaged());
        result.put("tickerRunning", tickerRunning);
        result.put("strategy", s.strategy());
        result.put("currentSession", session(s.currentSession()));
        result.put("prestartAccountId", s.prestartAccountId());
        return result;
    }

    static JSONObject stats(PoolStats s) {
        JSONObject result = new JSONObject();
        result.put("totalEvents", s.totalEvents());
        result.put("eventsByType", s.eventsByType());
        result.put("eventsBySeverity", s.eventsBySeverity());
        result.put("rotations", s.rotations());
        result.put("emergencyActivations", s.emergencyActivations());
        result.put("poolExhaustions", s.poolExhaustions());
        result.put("totalSessions", s.totalSessions());
        result.put("totalSuccess", s.totalSuccess());
        result.put("totalFailures", s.totalFailures());
        result.put("successRate", s.successRate());
        result.put("usedTodayMinutes", s.usedToday().toMinutes());
        result.put("remainingTodayMinutes", s.remainingToday().toMinutes());
        result.put("nextSwitchTime", text(s.nextSwitchTime()));
        return result;
    }

    static JSONObject event(PoolEvent e) {
        JSONObject item = new JSONObject();
        item.put("id", e.id());
        item.put("timestamp", text(e.timestamp()));
        item.put("type", e.type());
        item.put("severity", e.severity());
        item.put("accountId", e.accountId());
        item.put("accountName", e.accountName());
        item.put("message", e.message());
        item.put("oldStatus", e.oldStatus());
        item.put("newStatus", e.newStatus());
        item.put("relatedAccountId", e.relatedAccountId());
        item.put("reason", e.reason());
        return item;
    }

    static JSONArray events(List<PoolEvent> events) {
        JSONArray arr = new JSONArray();
        for (PoolEvent e : events) {
            arr.add(event(e));
        }
        return arr;
    }

    private static JSONObject telemetry(ResourceTelemetry t) {
        if (t == null) {
            return null;
        }
        JSONObject result = new JSONObject();
        result.put("gpuName", t.gpuName());
        result.put("memoryUsedGb", t.memoryUsedGb());
        result.put("memoryTotalGb", t.memoryTotalGb());
        result.put("memoryFreeGb", t.memoryFreeGb());
        result.put("utilizationPercent", t.utilizationPercent());
        result.put("temperatureCelsius", t.temperatureCelsius());
        return result;
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
