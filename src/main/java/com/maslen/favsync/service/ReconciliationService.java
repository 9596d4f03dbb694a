package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.TaskKey;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep that repairs drift between the task table and reality:
 * <ul>
 * <li>EXECUTING rows nobody touched for too long and not queued or running in this
 * process (process crash) are failed, the producer's retry policy then picks them up
 * again;</li>
 * <li>optionally, PENDING rows for videos that left their favorite list are pruned;</li>
 * <li>optionally, queued rows for a video already completed into the same destination
 * by another favorite list are pruned.</li>
 * </ul>
 * Nothing here is needed for deduplication, which the unique task key already
 * guarantees, so failures are only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationService {

    private final TaskStore taskStore;
    private final CatalogSource catalogSource;
    private final TaskExecutionService executionService;
    private final SyncProperties properties;

    @Scheduled(initialDelayString = "${favsync.reconcile.interval:300}",
            fixedDelayString = "${favsync.reconcile.interval:300}", timeUnit = TimeUnit.SECONDS)
    public void reconcile() {
        if (!properties.getReconcile().isEnabled()) {
            return;
        }
        try {
            SweepReport report = sweep();
            log.info("[RECONCILE] Sweep done: {} stuck recovered, {} missing pruned, {} duplicates pruned",
                    report.getRecovered(), report.getPrunedMissing(), report.getPrunedDuplicates());
        } catch (Exception e) {
            log.error("[RECONCILE] Error in reconciliation sweep: {}", e.getMessage(), e);
        }
    }

    public SweepReport sweep() {
        SyncProperties.Reconcile settings = properties.getReconcile();
        SweepReport report = new SweepReport();
        if (settings.isRecoverStuckExecuting()) {
            report.recovered = recoverStuck();
        }
        logCompleted();
        if (settings.isPruneMissingFromCatalog()) {
            report.prunedMissing = pruneMissingFromCatalog();
        }
        if (settings.isPruneDownloaded()) {
            report.prunedDuplicates = pruneDownloaded();
        }
        return report;
    }

    int recoverStuck() {
        long stuckAfter = properties.getReconcile().getStuckAfter() > 0
                ? properties.getReconcile().getStuckAfter()
                : properties.getTaskTimeout() * 2;
        LocalDateTime threshold = LocalDateTime.now().minusSeconds(stuckAfter);
        List<SyncTask> stuck = taskStore.findStale(TaskStatus.EXECUTING, threshold);
        int recovered = 0;
        for (SyncTask task : stuck) {
            if (executionService.isInFlight(task.getTaskKey())) {
                log.debug("[RECONCILE] Task {} is still queued or running here, leaving it", task.getTaskKey());
                continue;
            }
            log.warn("[RECONCILE] Task {} stuck in EXECUTING since {}, marking it failed", task.getTaskKey(),
                    task.getUpdatedAt());
            if (taskStore.transition(task.getTaskKey(), TaskStatus.EXECUTING, TaskStatus.FAILED,
                    "Task " + task.getTaskKey() + " stuck in executing for more than " + stuckAfter + "s")) {
                recovered++;
            }
        }
        return recovered;
    }

    private void logCompleted() {
        Map<String, Integer> completedPerList = new HashMap<>();
        for (SyncTask task : taskStore.findByStatus(TaskType.BILI_VIDEO, EnumSet.of(TaskStatus.COMPLETED))) {
            completedPerList.merge(TaskKey.parse(task.getTaskKey()).get(TaskKey.FAVID), 1, Integer::sum);
        }
        completedPerList.forEach((name, count) -> log.debug("[RECONCILE] {} completed videos in {}", count, name));
    }

    int pruneMissingFromCatalog() {
        Map<String, Set<String>> catalog = new HashMap<>();
        for (String name : properties.polledFavoriteLists().keySet()) {
            try {
                catalog.put(name, new HashSet<>(catalogSource.fetch(name)));
            } catch (IOException e) {
                log.warn("[RECONCILE] Cannot load favorite list {}, not pruning it: {}", name, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 0;
            }
        }
        int pruned = 0;
        for (SyncTask task : taskStore.findByStatus(TaskType.BILI_VIDEO, EnumSet.of(TaskStatus.PENDING))) {
            TaskKey key = TaskKey.parse(task.getTaskKey());
            Set<String> items = catalog.get(key.get(TaskKey.FAVID));
            if (items != null && !items.contains(key.get(TaskKey.BVID)) && taskStore.delete(task.getTaskKey())) {
                pruned++;
                log.info("[RECONCILE] Deleted stale task {}: no longer in favorite list", task.getTaskKey());
            }
        }
        return pruned;
    }

    int pruneDownloaded() {
        Map<String, Set<String>> completedPerPath = new HashMap<>();
        for (SyncTask task : taskStore.findByStatus(TaskType.BILI_VIDEO, EnumSet.of(TaskStatus.COMPLETED))) {
            TaskKey key = TaskKey.parse(task.getTaskKey());
            completedPerPath.computeIfAbsent(destinationOf(key), path -> new HashSet<>()).add(key.get(TaskKey.BVID));
        }
        int pruned = 0;
        for (SyncTask task : taskStore.findByStatus(TaskType.BILI_VIDEO,
                EnumSet.of(TaskStatus.PENDING, TaskStatus.EXECUTING))) {
            TaskKey key = TaskKey.parse(task.getTaskKey());
            Set<String> downloaded = completedPerPath.get(destinationOf(key));
            if (downloaded != null && downloaded.contains(key.get(TaskKey.BVID))
                    && taskStore.delete(task.getTaskKey())) {
                pruned++;
                log.info("[RECONCILE] Deleted stale task {}: already downloaded to the same destination",
                        task.getTaskKey());
            }
        }
        return pruned;
    }

    private String destinationOf(TaskKey key) {
        return properties.favoriteListOrDefault(key.get(TaskKey.FAVID)).getPath();
    }

    @Data
    public static class SweepReport {
        private int recovered;
        private int prunedMissing;
        private int prunedDuplicates;
    }
}
