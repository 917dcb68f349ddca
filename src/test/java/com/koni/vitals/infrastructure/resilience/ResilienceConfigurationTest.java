package com.koni.vitals.infrastructure.resilience;

import com.koni.vitals.tags.UnitTest;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class ResilienceConfigurationTest {

    private final ResilienceConfiguration configuration = new ResilienceConfiguration();

    @Test
    void shouldTreatConflictsAndLockFailuresAsTransient() {
        assertThat(ResilienceConfiguration.isTransientStorageFailure(new DuplicateKeyException("devices_pkey"))).isTrue();
        assertThat(ResilienceConfiguration.isTransientStorageFailure(new CannotAcquireLockException("lock"))).isTrue();
        assertThat(ResilienceConfiguration.isTransientStorageFailure(new QueryTimeoutException("slow"))).isTrue();
    }

    @Test
    void shouldNotRetryUnavailableStore() {
        assertThat(ResilienceConfiguration.isTransientStorageFailure(
                new DataAccessResourceFailureException("connection refused"))).isFalse();
        assertThat(ResilienceConfiguration.isTransientStorageFailure(new IllegalStateException("bug"))).isFalse();
    }

    @Test
    void shouldRetryCommitUntilTransientConflictClears() {
        // Given
        Retry retry = configuration.commitRetry(configuration.retryRegistry(3));
        AtomicInteger attempts = new AtomicInteger();

        // When
        String result = retry.executeSupplier(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new DuplicateKeyException("devices_pkey");
            }
            return "committed";
        });

        // Then
        assertThat(result).isEqualTo("committed");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        // Given
        Retry retry = configuration.commitRetry(configuration.retryRegistry(2));
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("lock");
        })).isInstanceOf(CannotAcquireLockException.class);
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void shouldFailFastOnNonTransientFailure() {
        // Given
        Retry retry = configuration.commitRetry(configuration.retryRegistry(3));
        AtomicInteger attempts = new AtomicInteger();

        // When / Then
        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            attempts.incrementAndGet();
            throw new DataAccessResourceFailureException("connection refused");
        })).isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }
}
