package com.gpupool.rotator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 节点探测用的 HttpClient
 * <p>
 * 超时、代理设置
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public HttpClient nodeHttpClient(AppProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getProvisioning().getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1);

        // 代理配置
        AppProperties.ProxyConfig proxy = properties.getProxy();
        if (proxy.isEnabled() && proxy.getUrl() != null && !proxy.getUrl().isEmpty()) {
            try {
                URI uri = URI.create(proxy.getUrl());
                String host = uri.getHost();
                int port = uri.getPort() > 0 ? uri.getPort() : 8080;
                builder.proxy(ProxySelector.of(new InetSocketAddress(host, port)));
                log.info("HTTP 代理已配置: {}:{}", host, port);
            } catch (IllegalArgumentException e) {
                log.warn("代理 URL 解析失败: {}, 将不使用代理", proxy.getUrl());
            }
        }

        return builder.build();
    }
}
