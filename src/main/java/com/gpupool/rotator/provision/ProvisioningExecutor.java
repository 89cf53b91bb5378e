package com.gpupool.rotator.provision;

import com.gpupool.rotator.exception.ProvisioningException;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 在工作线程上执行 Provisioner 调用
 * <p>
 * 每次调用带超时；异常和超时统一折算为失败结果，返回的 future 不会异常完成
 */
public class ProvisioningExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProvisioningExecutor.class);

    private final Provisioner provisioner;
    private final Executor executor;
    private final ProvisioningTimeouts timeouts;
    private final Metrics metrics;

    public ProvisioningExecutor(Provisioner provisioner, Executor executor, ProvisioningTimeouts timeouts,
                                Metrics metrics) {
        this.provisioner = provisioner;
        this.executor = executor;
        this.timeouts = timeouts;
        this.metrics = metrics;
    }

    /**
     * 异步执行
     */
    public CompletableFuture<ProvisionResult> submit(OperationKind kind, AccountSnapshot account) {
        return submit(kind, account, () -> invoke(kind, account));
    }

    /**
     * 先释放再开通（重启会话）
     */
    public CompletableFuture<ProvisionResult> restart(AccountSnapshot account) {
        return submit(OperationKind.START, account, () -> {
            try {
                provisioner.stopSession(account);
            } catch (RuntimeException e) {
                log.warn("重启前释放会话失败: {}, {}", account.label(), e.getMessage());
            }
            return provisioner.startSession(account);
        });
    }

    /**
     * 同步执行（阻塞调用线程，不得持有调度器锁）
     */
    public ProvisionResult runNow(OperationKind kind, AccountSnapshot account) {
        try {
            return submit(kind, account).get(timeouts.forKind(kind).toMillis() + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProvisionResult.failure("操作被中断");
        } catch (ExecutionException | TimeoutException e) {
            return ProvisionResult.failure(kind + " 超时");
        }
    }

    private CompletableFuture<ProvisionResult> submit(OperationKind kind, AccountSnapshot account,
                                                      Supplier<ProvisionResult> call) {
        long start = System.currentTimeMillis();
        return CompletableFuture.supplyAsync(call, executor)
                .orTimeout(timeouts.forKind(kind).toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    ProvisionResult outcome = ex == null ? normalize(result) : toFailure(kind, account, ex);
                    long latency = System.currentTimeMillis() - start;
                    metrics.recordProvisioning(kind.name(), outcome.success(), latency);
                    if (!outcome.success()) {
                        log.warn("Provisioner 调用失败: op={}, account={}, fatal={}, {}ms, {}",
                                kind, account.label(), outcome.fatal(), latency, outcome.message());
                    } else {
                        log.debug("Provisioner 调用完成: op={}, account={}, {}ms", kind, account.label(), latency);
                    }
                    return outcome;
                });
    }

    private ProvisionResult invoke(OperationKind kind, AccountSnapshot account) {
        return switch (kind) {
            case START, PRESTART -> provisioner.startSession(account);
            case HEALTH, RETRY, RECOVER -> provisioner.healthCheck(account);
            case STOP -> {
                provisioner.stopSession(account);
                yield ProvisionResult.ok();
            }
        };
    }

    private static ProvisionResult normalize(ProvisionResult result) {
        return result != null ? result : ProvisionResult.failure("Provisioner 未返回结果");
    }

    private static ProvisionResult toFailure(OperationKind kind, AccountSnapshot account, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return ProvisionResult.failure(kind + " 超时 (" + account.label() + ")");
        }
        if (cause instanceof ProvisioningException pe) {
            return pe.isFatal() ? ProvisionResult.fatal(pe.getMessage()) : ProvisionResult.failure(pe.getMessage());
        }
        log.error("Provisioner 调用异常: op={}, account={}", kind, account.label(), cause);
        return ProvisionResult.failure(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
}
