package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.entity.SyncTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Claims PENDING tasks, oldest first, and hands them to the
 * {@link TaskExecutionService} without waiting for them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskConsumer {

    private final TaskStore taskStore;
    private final TaskExecutionService executionService;
    private final SyncProperties properties;

    @Scheduled(fixedDelayString = "${favsync.consumer-poll:1000}")
    public void poll() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("[CONSUMER] Error in consumer poll: {}", e.getMessage(), e);
            backOff();
        }
    }

    /**
     * @return number of tasks claimed and dispatched
     */
    public int pollOnce() {
        List<SyncTask> pending = taskStore.listPending(null);
        int dispatched = 0;
        for (SyncTask task : pending) {
            if (!taskStore.claim(task.getTaskKey())) {
                log.debug("[CONSUMER] Task {} was claimed elsewhere", task.getTaskKey());
                continue;
            }
            Optional<SyncTask> claimed = taskStore.findByKey(task.getTaskKey());
            if (claimed.isEmpty()) {
                log.warn("[CONSUMER] Task {} disappeared right after its claim", task.getTaskKey());
                continue;
            }
            executionService.submit(claimed.get());
            dispatched++;
            log.info("[CONSUMER] Scheduled task {}, {} pending tasks remaining", task.getTaskKey(),
                    pending.size() - dispatched);
        }
        return dispatched;
    }

    private void backOff() {
        try {
            Thread.sleep(properties.getConsumerErrorBackoff());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
