package com.gpupool.rotator.controller;

import com.alibaba.fastjson2.JSONObject;
import com.gpupool.rotator.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * API Key 验证过滤器
 * <p>
 * 对 /api/ 开头的请求验证 X-API-Key 头或 Authorization 头中的 Bearer token
 */
@Component
@Order(10)
public class ApiKeyFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    private final AppProperties properties;

    public ApiKeyFilter(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // 仅对 API 路径验证
        if (!path.startsWith("/api/")) {
            return chain.filter(exchange);
        }

        // 不要求 API Key 时跳过
        if (!properties.isRequireApiKey()) {
            return chain.filter(exchange);
        }

        String apiKey = extractKey(exchange);
        if (apiKey == null || apiKey.isEmpty()) {
            return unauthorized(exchange, "缺少 API Key");
        }

        if (!MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8),
                properties.getApiKey().getBytes(StandardCharsets.UTF_8))) {
            log.warn("无效的 API Key: {}***", apiKey.substring(0, Math.min(8, apiKey.length())));
            return unauthorized(exchange, "无效的 API Key");
        }

        return chain.filter(exchange);
    }

    private static String extractKey(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst("X-API-Key");
        if (header != null) {
            return header.trim();
        }
        String authHeader = exchange.getRequest().getHeaders().getFirst("Authorization");
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7).trim();
        }
        return null;
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = JSONObject.of("type", "error", "error",
                JSONObject.of("type", "authentication_error", "message", message)).toJSONString();
        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8)))
        );
    }
}
