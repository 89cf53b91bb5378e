package com.gpupool.rotator.provision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gpupool.rotator.exception.ProvisioningException;
import com.gpupool.rotator.pool.AccountDefaults;
import com.gpupool.rotator.pool.AccountRegistry;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.AccountSpec;
import com.gpupool.rotator.util.Metrics;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ProvisioningExecutorTest {

    private Provisioner provisioner;
    private Metrics metrics;
    private ProvisioningExecutor executor;
    private AccountSnapshot account;

    @BeforeEach
    void setUp() {
        provisioner = mock(Provisioner.class);
        metrics = new Metrics();
        executor = new ProvisioningExecutor(provisioner, Runnable::run, ProvisioningTimeouts.defaults(), metrics);
        account = new AccountRegistry(AccountDefaults.standard())
                .add(AccountSpec.of("node-1"), Instant.parse("2026-03-10T08:00:00Z"))
                .snapshot();
    }

    @Nested
    @DisplayName("operation routing")
    class Routing {

        @Test
        @DisplayName("start and prestart open a session")
        void startKinds() {
            when(provisioner.startSession(any())).thenReturn(ProvisionResult.ok());

            assertThat(executor.submit(OperationKind.START, account).join().success()).isTrue();
            assertThat(executor.submit(OperationKind.PRESTART, account).join().success()).isTrue();
            assertThat(metrics.get("provisioning_start_success")).isEqualTo(1);
            assertThat(metrics.get("provisioning_prestart_success")).isEqualTo(1);
        }

        @Test
        @DisplayName("health, retry and recover all probe health")
        void healthKinds() {
            when(provisioner.healthCheck(any())).thenReturn(ProvisionResult.failure("down"));

            for (OperationKind kind : new OperationKind[]{OperationKind.HEALTH, OperationKind.RETRY, OperationKind.RECOVER}) {
                assertThat(executor.submit(kind, account).join().message()).isEqualTo("down");
            }
            assertThat(metrics.get("provisioning_health_failure")).isEqualTo(1);
        }

        @Test
        @DisplayName("stop reports success once the session is released")
        void stop() {
            assertThat(executor.submit(OperationKind.STOP, account).join()).isEqualTo(ProvisionResult.ok());
            verify(provisioner).stopSession(account);
        }

        @Test
        @DisplayName("restart releases before starting again")
        void restart() {
            when(provisioner.startSession(any())).thenReturn(ProvisionResult.ok());

            assertThat(executor.restart(account).join().success()).isTrue();

            InOrder order = inOrder(provisioner);
            order.verify(provisioner).stopSession(account);
            order.verify(provisioner).startSession(account);
        }

        @Test
        @DisplayName("restart still starts when the release fails")
        void restartIgnoresStopFailure() {
            doThrow(new IllegalStateException("gone")).when(provisioner).stopSession(any());
            when(provisioner.startSession(any())).thenReturn(ProvisionResult.ok());

            assertThat(executor.restart(account).join().success()).isTrue();
        }
    }

    @Nested
    @DisplayName("failure mapping")
    class FailureMapping {

        @Test
        @DisplayName("unexpected exceptions become a plain failure")
        void runtimeException() {
            when(provisioner.startSession(any())).thenThrow(new IllegalStateException("kaput"));

            ProvisionResult result = executor.submit(OperationKind.START, account).join();

            assertThat(result.success()).isFalse();
            assertThat(result.fatal()).isFalse();
            assertThat(result.message()).contains("kaput");
        }

        @Test
        @DisplayName("a fatal provisioning exception becomes a fatal result")
        void fatalException() {
            when(provisioner.healthCheck(any()))
                    .thenThrow(new ProvisioningException(account.id(), "banned", true));

            ProvisionResult result = executor.submit(OperationKind.HEALTH, account).join();

            assertThat(result.fatal()).isTrue();
            assertThat(result.message()).isEqualTo("banned");
        }

        @Test
        @DisplayName("a null result is treated as a failure")
        void nullResult() {
            when(provisioner.healthCheck(any())).thenReturn(null);

            assertThat(executor.runNow(OperationKind.HEALTH, account).success()).isFalse();
        }

        @Test
        @DisplayName("calls that outlive their timeout fail instead of hanging")
        void timeout() {
            ProvisioningExecutor slow = new ProvisioningExecutor(provisioner, task -> new Thread(task).start(),
                    new ProvisioningTimeouts(Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(50)),
                    metrics);
            when(provisioner.healthCheck(any())).thenAnswer(inv -> {
                Thread.sleep(2000);
                return ProvisionResult.ok();
            });

            ProvisionResult result = slow.submit(OperationKind.HEALTH, account).join();

            assertThat(result.success()).isFalse();
            assertThat(result.message()).contains("超时");
        }
    }
}
