package com.gpupool.rotator.config;

import com.gpupool.rotator.event.EventLog;
import com.gpupool.rotator.event.PoolEventBus;
import com.gpupool.rotator.pool.AccountRegistry;
import com.gpupool.rotator.provision.HttpProvisioner;
import com.gpupool.rotator.provision.Provisioner;
import com.gpupool.rotator.provision.ProvisioningExecutor;
import com.gpupool.rotator.scheduler.RotationScheduler;
import com.gpupool.rotator.store.JdbcPoolStore;
import com.gpupool.rotator.store.PoolStore;
import com.gpupool.rotator.util.Metrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 调度器装配
 * <p>
 * 所有池组件显式构造，调度器是唯一持有池状态的实例
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Metrics metrics() {
        return new Metrics();
    }

    @Bean
    public EventLog eventLog(AppProperties properties) {
        return new EventLog(properties.getEvents().getHistorySize());
    }

    @Bean
    public PoolEventBus poolEventBus() {
        return new PoolEventBus();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService provisioningThreads(AppProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "provision-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(properties.getProvisioning().getThreads(), factory);
    }

    @Bean
    @ConditionalOnMissingBean(Provisioner.class)
    public Provisioner provisioner(HttpClient nodeHttpClient, AppProperties properties) {
        AppProperties.ProvisioningConfig config = properties.getProvisioning();
        return new HttpProvisioner(nodeHttpClient, Duration.ofSeconds(config.getHealthTimeoutSeconds()),
                config.getStartAttempts(), config.getBaseDelayMs());
    }

    @Bean
    public ProvisioningExecutor provisioningExecutor(Provisioner provisioner, ExecutorService provisioningThreads,
                                                     AppProperties properties, Metrics metrics) {
        return new ProvisioningExecutor(provisioner, provisioningThreads,
                properties.getProvisioning().toTimeouts(), metrics);
    }

    @Bean
    public PoolStore poolStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        return new JdbcPoolStore(jdbc, new TransactionTemplate(transactionManager));
    }

    /**
     * 依赖 DatabaseConfig 保证 schema 已建好再加载
     */
    @Bean
    public RotationScheduler rotationScheduler(Clock clock, AppProperties properties,
                                               ProvisioningExecutor provisioningExecutor, PoolStore poolStore,
                                               EventLog eventLog, PoolEventBus poolEventBus, Metrics metrics,
                                               DatabaseConfig databaseConfig) {
        RotationScheduler scheduler = new RotationScheduler(clock,
                new AccountRegistry(properties.getAccounts().toDefaults()),
                provisioningExecutor, poolStore, eventLog, poolEventBus, metrics,
                properties.getDefaults().toSettings());
        scheduler.load();
        return scheduler;
    }
}
