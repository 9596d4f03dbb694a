package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Decides when the producer may put a FAILED task back to PENDING: a bounded
 * number of attempts, spaced by an exponential back-off.
 */
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final SyncProperties properties;

    public boolean exhausted(SyncTask task) {
        int maxAttempts = properties.getRetry().getMaxAttempts();
        return maxAttempts > 0 && task.getAttempts() >= maxAttempts;
    }

    public boolean shouldRetry(SyncTask task, LocalDateTime now) {
        if (task.getStatus() != TaskStatus.FAILED || exhausted(task)) {
            return false;
        }
        LocalDateTime lastUpdate = task.getUpdatedAt();
        return lastUpdate == null || !lastUpdate.plus(backoff(task.getAttempts())).isAfter(now);
    }

    /** Wait after the given number of attempts: backoff * 2^(attempts-1), capped. */
    public Duration backoff(int attempts) {
        SyncProperties.Retry retry = properties.getRetry();
        if (attempts < 1 || retry.getBackoff() <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(attempts - 1, 30);
        long seconds = retry.getBackoff() * (1L << shift);
        if (seconds < 0 || seconds > retry.getMaxBackoff()) {
            seconds = retry.getMaxBackoff();
        }
        return Duration.ofSeconds(seconds);
    }
}
