package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.TaskPayload;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.service.handler.BiliVideoTaskHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes claimed tasks. Claims queue up for a fixed pool of
 * {@code max-concurrent-tasks} dispatch threads; each dispatch thread takes a permit
 * from the {@link ConcurrencyLimiter}, hands the work to a worker thread and waits
 * for it at most {@code task-timeout} seconds. The permit is returned on every exit
 * path before the final status is written.
 * <p>
 * Status writes are fenced by the attempt counter of the claim, so a run that lost
 * its claim (manual override, recovery) never overwrites the row.
 */
@Slf4j
@Service
public class TaskExecutionService {

    private final TaskStore taskStore;
    private final ConcurrencyLimiter limiter;
    private final BiliVideoTaskHandler biliVideoTaskHandler;
    private final SyncProperties properties;

    private final ExecutorService dispatchPool;
    private final ExecutorService workerPool = Executors.newCachedThreadPool(namedThreads("task-worker-"));

    /** task key to attempt, for every claim submitted and not finished yet. */
    private final ConcurrentMap<String, Integer> inFlight = new ConcurrentHashMap<>();

    public TaskExecutionService(TaskStore taskStore, ConcurrencyLimiter limiter,
            BiliVideoTaskHandler biliVideoTaskHandler, SyncProperties properties) {
        this.taskStore = taskStore;
        this.limiter = limiter;
        this.biliVideoTaskHandler = biliVideoTaskHandler;
        this.properties = properties;
        this.dispatchPool = Executors.newFixedThreadPool(limiter.getMaxPermits(), namedThreads("task-dispatch-"));
    }

    /**
     * Queues a claimed task without waiting for it.
     *
     * @param claimed the task as read after its claim, its attempt counter identifies the claim
     * @return completes with the final status once it is stored
     */
    public CompletableFuture<TaskStatus> submit(SyncTask claimed) {
        String taskKey = claimed.getTaskKey();
        int attempt = claimed.getAttempts();
        TaskPayload payload;
        try {
            payload = taskStore.readPayload(claimed);
        } catch (IllegalStateException e) {
            log.error("[EXECUTOR] Task {} has an unreadable payload", taskKey, e);
            taskStore.finishAttempt(taskKey, attempt, TaskStatus.FAILED, "Unreadable task payload: " + e.getMessage());
            return CompletableFuture.completedFuture(TaskStatus.FAILED);
        }
        inFlight.put(taskKey, attempt);
        try {
            return CompletableFuture.supplyAsync(() -> execute(taskKey, attempt, payload), dispatchPool)
                    .whenComplete((status, error) -> inFlight.remove(taskKey, attempt));
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskKey, attempt);
            throw e;
        }
    }

    TaskStatus execute(String taskKey, int attempt, TaskPayload payload) {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finish(taskKey, attempt, TaskStatus.FAILED, "Task " + taskKey + " interrupted before it started");
        }

        TaskStatus status;
        String errorMessage = null;
        Future<?> work = null;
        try {
            if (!taskStore.markStarted(taskKey, attempt)) {
                log.warn("[EXECUTOR] Task {} changed while queued, not running it", taskKey);
                return currentStatus(taskKey);
            }
            work = workerPool.submit(() -> {
                dispatch(payload);
                return null;
            });
            work.get(properties.getTaskTimeout(), TimeUnit.SECONDS);
            status = TaskStatus.COMPLETED;
        } catch (TimeoutException e) {
            work.cancel(true);
            status = TaskStatus.FAILED;
            errorMessage = "Task " + taskKey + " timed out after " + properties.getTaskTimeout() + "s";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[EXECUTOR] Error processing task {}", taskKey, cause);
            status = TaskStatus.FAILED;
            errorMessage = "Error processing task " + taskKey + ": " + describe(cause);
        } catch (InterruptedException e) {
            if (work != null) {
                work.cancel(true);
            }
            Thread.currentThread().interrupt();
            status = TaskStatus.FAILED;
            errorMessage = "Task " + taskKey + " cancelled";
        } catch (RuntimeException e) {
            log.error("[EXECUTOR] Could not start task {}", taskKey, e);
            status = TaskStatus.FAILED;
            errorMessage = "Error processing task " + taskKey + ": " + describe(e);
        } finally {
            limiter.release();
        }
        return finish(taskKey, attempt, status, errorMessage);
    }

    void dispatch(TaskPayload payload) throws Exception {
        if (payload instanceof BiliVideoPayload video) {
            biliVideoTaskHandler.handle(video);
        } else {
            throw new IllegalStateException("No handler for task type " + payload.type());
        }
    }

    private TaskStatus finish(String taskKey, int attempt, TaskStatus status, String errorMessage) {
        if (status == TaskStatus.COMPLETED) {
            log.info("[EXECUTOR] Task {} completed successfully", taskKey);
        } else {
            log.warn("[EXECUTOR] {}", errorMessage);
        }
        try {
            if (!taskStore.finishAttempt(taskKey, attempt, status, errorMessage)) {
                log.warn("[EXECUTOR] Task {} changed while running, status {} not stored", taskKey, status);
            }
        } catch (RuntimeException e) {
            // the reconciliation sweep recovers rows left in EXECUTING
            log.error("[EXECUTOR] Could not store status {} of task {}", status, taskKey, e);
        }
        return status;
    }

    private TaskStatus currentStatus(String taskKey) {
        return taskStore.findByKey(taskKey).map(SyncTask::getStatus).orElse(TaskStatus.FAILED);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    public int inFlight() {
        return inFlight.size();
    }

    /** The task was submitted by this process and has not finished yet. */
    public boolean isInFlight(String taskKey) {
        return inFlight.containsKey(taskKey);
    }

    @PreDestroy
    public void shutdown() {
        log.info("[EXECUTOR] Shutting down, {} tasks in flight", inFlight.size());
        dispatchPool.shutdownNow();
        workerPool.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
