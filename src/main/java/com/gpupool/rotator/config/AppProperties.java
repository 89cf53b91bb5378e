package com.gpupool.rotator.config;

import com.gpupool.rotator.pool.AccountDefaults;
import com.gpupool.rotator.pool.AccountTier;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.pool.ProviderType;
import com.gpupool.rotator.pool.RotationStrategy;
import com.gpupool.rotator.provision.ProvisioningTimeouts;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "pool")
public class AppProperties {

    private String apiKey = "sk-gpupool-default";
    private boolean requireApiKey = true;
    private TickConfig tick = new TickConfig();
    private DatabaseConfig database = new DatabaseConfig();
    private LoggingConfig logging = new LoggingConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private ProvisioningConfig provisioning = new ProvisioningConfig();
    private EventsConfig events = new EventsConfig();
    private AccountDefaultsConfig accounts = new AccountDefaultsConfig();
    private SettingsConfig defaults = new SettingsConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class TickConfig {
        private long intervalMs = 10000;
        private boolean autoStart = true;
    }

    @Data
    public static class DatabaseConfig {
        private String path = "data/gpu-pool.db";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class ProvisioningConfig {
        private int threads = 4;
        private int connectTimeoutSeconds = 10;
        private int healthTimeoutSeconds = 5;
        private int startTimeoutSeconds = 120;
        private int stopTimeoutSeconds = 30;
        // 开通时探测节点的次数和退避基数
        private int startAttempts = 3;
        private long baseDelayMs = 2000;

        public ProvisioningTimeouts toTimeouts() {
            return new ProvisioningTimeouts(Duration.ofSeconds(healthTimeoutSeconds),
                    Duration.ofSeconds(startTimeoutSeconds), Duration.ofSeconds(stopTimeoutSeconds));
        }
    }

    @Data
    public static class EventsConfig {
        private int historySize = 500;
        private int heartbeatSeconds = 30;
    }

    @Data
    public static class AccountDefaultsConfig {
        private int priority = 100;
        private int dailyQuotaMinutes = 720;
        private int maxSessionHours = 12;
        private ProviderType provider = ProviderType.GOOGLE_COLAB;
        private AccountTier tier = AccountTier.FREE;

        public AccountDefaults toDefaults() {
            return new AccountDefaults(priority, Duration.ofMinutes(dailyQuotaMinutes),
                    Duration.ofHours(maxSessionHours), provider, tier);
        }
    }

    /**
     * 存储中没有设置时使用的默认池设置
     */
    @Data
    public static class SettingsConfig {
        private String strategy = "priority";
        private int cooldownMinutes = 60;
        private int lowQuotaThresholdPercent = 90;
        private boolean autoFailover = true;
        private boolean autoRotateOnQuotaLow = true;
        private int maxConsecutiveFailures = 3;
        private int errorRetrySeconds = 60;
        private boolean autoPrestart = true;
        private int prestartLeadMinutes = 5;
        private int healthCheckSeconds = 60;

        public PoolSettings toSettings() {
            return new PoolSettings(RotationStrategy.fromName(strategy), Duration.ofMinutes(cooldownMinutes),
                    lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow, maxConsecutiveFailures,
                    Duration.ofSeconds(errorRetrySeconds), autoPrestart, Duration.ofMinutes(prestartLeadMinutes),
                    Duration.ofSeconds(healthCheckSeconds));
        }
    }
}
