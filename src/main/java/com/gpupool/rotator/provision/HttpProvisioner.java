package com.gpupool.rotator.provision;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.ResourceTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 基于节点 HTTP 端点的 Provisioner
 * <p>
 * 只探测 {endpoint}/health，不驱动远程浏览器或 Notebook。
 * 未配置 endpoint 的账号视为人工维护的节点，始终健康
 */
public class HttpProvisioner implements Provisioner {

    private static final Logger log = LoggerFactory.getLogger(HttpProvisioner.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final int startAttempts;
    private final long baseDelayMs;

    public HttpProvisioner(HttpClient httpClient, Duration requestTimeout, int startAttempts, long baseDelayMs) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.startAttempts = Math.max(1, startAttempts);
        this.baseDelayMs = baseDelayMs;
    }

    /**
     * 节点开通后需要一段时间才能响应，失败时按 delay × 2^attempt 重试探测
     */
    @Override
    public ProvisionResult startSession(AccountSnapshot account) {
        ProvisionResult result = healthCheck(account);
        for (int attempt = 0; !result.success() && !result.fatal() && attempt < startAttempts - 1; attempt++) {
            long delay = baseDelayMs * (1L << attempt);
            log.info("节点尚未就绪: {}, 第{}次重试, 等待{}ms", account.label(), attempt + 1, delay);
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ProvisionResult.failure("开通被中断");
            }
            result = healthCheck(account);
        }
        return result;
    }

    @Override
    public void stopSession(AccountSnapshot account) {
        // 节点由外部托管，这里只记录释放
        log.info("释放节点会话: {} ({})", account.label(), account.endpoint() != null ? account.endpoint() : "无端点");
    }

    @Override
    public ProvisionResult healthCheck(AccountSnapshot account) {
        if (account.endpoint() == null || account.endpoint().isBlank()) {
            return ProvisionResult.ok();
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(trimSlash(account.endpoint()) + "/health"))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int statusCode = response.statusCode();

            // 401/403 认证失效，不重试
            if (statusCode == 401 || statusCode == 403) {
                return ProvisionResult.fatal("节点拒绝访问: HTTP " + statusCode);
            }
            if (statusCode < 200 || statusCode >= 300) {
                return ProvisionResult.failure("节点健康检查失败: HTTP " + statusCode);
            }
            return ProvisionResult.ok(parseTelemetry(response.body()));
        } catch (IOException e) {
            return ProvisionResult.failure("节点不可达: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProvisionResult.failure("健康检查被中断");
        }
    }

    /**
     * 健康检查响应中的 GPU 信息：{"gpu_name":..,"memory_used_gb":..,"memory_total_gb":..,"utilization":..,"temperature":..}
     */
    static ResourceTelemetry parseTelemetry(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JSONObject json = JSON.parseObject(body);
            if (json == null || !json.containsKey("gpu_name")) {
                return null;
            }
            return new ResourceTelemetry(
                    json.getString("gpu_name"),
                    json.getDoubleValue("memory_used_gb"),
                    json.getDoubleValue("memory_total_gb"),
                    json.getDoubleValue("utilization"),
                    json.getDouble("temperature"));
        } catch (Exception e) {
            log.debug("健康检查响应不是 JSON, 忽略遥测: {}", e.getMessage());
            return null;
        }
    }

    private static String trimSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
