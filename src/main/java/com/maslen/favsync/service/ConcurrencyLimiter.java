package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;

/**
 * Counting gate on simultaneous task executions. Permits are handed out in
 * arrival order.
 */
@Slf4j
@Component
public class ConcurrencyLimiter {

    private final int maxPermits;
    private final Semaphore permits;

    @Autowired
    public ConcurrencyLimiter(SyncProperties properties) {
        this(properties.getMaxConcurrentTasks());
    }

    ConcurrencyLimiter(int maxPermits) {
        if (maxPermits < 1) {
            throw new IllegalArgumentException("At least one permit is required, got " + maxPermits);
        }
        this.maxPermits = maxPermits;
        this.permits = new Semaphore(maxPermits, true);
    }

    /** Blocks until a permit is free. */
    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    public void release() {
        permits.release();
    }

    public int getMaxPermits() {
        return maxPermits;
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int inUse() {
        return maxPermits - permits.availablePermits();
    }
}
