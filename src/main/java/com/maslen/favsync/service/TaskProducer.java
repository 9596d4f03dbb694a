package com.maslen.favsync.service;

import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.exceptions.DuplicateTaskException;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.CatalogItem;
import com.maslen.favsync.model.TaskKey;
import com.maslen.favsync.model.TaskStatus;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Polls the favorite lists and admits new videos as PENDING tasks.
 * <p>
 * Per video: no task yet, create one; FAILED, back to PENDING when the retry policy
 * allows; PENDING, EXECUTING or COMPLETED, nothing to do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskProducer {

    private final CatalogSource catalogSource;
    private final TaskStore taskStore;
    private final RetryPolicy retryPolicy;

    @Scheduled(fixedDelayString = "${favsync.interval:1200}", timeUnit = TimeUnit.SECONDS)
    public void produce() {
        try {
            CycleReport report = runCycle();
            log.info("[PRODUCER] Cycle done: {} created, {} retried, {} skipped", report.getCreated(),
                    report.getRetried(), report.getSkipped());
        } catch (Exception e) {
            log.error("[PRODUCER] Error in producer cycle: {}", e.getMessage(), e);
        }
    }

    public CycleReport runCycle() {
        CycleReport report = new CycleReport();
        try (Stream<CatalogItem> items = catalogSource.discover()) {
            Iterator<CatalogItem> iterator = items.iterator();
            while (iterator.hasNext()) {
                admit(iterator.next(), report);
            }
        }
        return report;
    }

    void admit(CatalogItem item, CycleReport report) {
        TaskKey key = TaskKey.biliVideo(item.getBvid(), item.getFavoriteName());
        Optional<SyncTask> existing = taskStore.findByKey(key);

        if (existing.isEmpty()) {
            try {
                taskStore.create(new BiliVideoPayload(item.getBvid(), item.getFavoriteName()));
                report.created++;
                log.info("[PRODUCER] Added new task {} for {}", item.getBvid(), item.getFavoriteName());
            } catch (DuplicateTaskException e) {
                report.skipped++;
                log.debug("[PRODUCER] Task {} was created concurrently", key);
            }
            return;
        }

        SyncTask task = existing.get();
        if (task.getStatus() != TaskStatus.FAILED) {
            report.skipped++;
            log.debug("[PRODUCER] Task {} ({}) is {}, skipping", item.getBvid(), item.getFavoriteName(),
                    task.getStatus());
            return;
        }
        if (retryPolicy.exhausted(task)) {
            report.skipped++;
            log.debug("[PRODUCER] Task {} failed {} times, not retrying", key, task.getAttempts());
            return;
        }
        if (!retryPolicy.shouldRetry(task, LocalDateTime.now())) {
            report.skipped++;
            log.debug("[PRODUCER] Task {} is backing off after {} attempts", key, task.getAttempts());
            return;
        }
        if (!taskStore.transition(task.getTaskKey(), TaskStatus.FAILED, TaskStatus.PENDING, null)) {
            report.skipped++;
            log.info("[PRODUCER] Task {} changed since it was read, not retrying it", key);
            return;
        }
        report.retried++;
        log.info("[PRODUCER] Reset failed task {} for {} to PENDING (attempt {})", item.getBvid(),
                item.getFavoriteName(), task.getAttempts() + 1);
    }

    @Data
    public static class CycleReport {
        private int created;
        private int retried;
        private int skipped;
    }
}
