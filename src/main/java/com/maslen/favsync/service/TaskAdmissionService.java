package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.exceptions.BadRequestException;
import com.maslen.favsync.exceptions.DuplicateTaskException;
import com.maslen.favsync.exceptions.NotFoundException;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Administrative entry points: manual submission, status override and deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskAdmissionService {

    private final TaskStore taskStore;
    private final SyncProperties properties;

    /**
     * Idempotent submission. A new video is created PENDING; a queued or running
     * task gets its payload refreshed; a COMPLETED or FAILED task is requeued.
     */
    public Admission submit(String bid, String favid) {
        if (bid == null || bid.isBlank()) {
            throw new BadRequestException("invalid-bid", "bid is required");
        }
        String favoriteName = favid == null || favid.isBlank() ? SyncProperties.NO_FAVORITE : favid.trim();
        if (!properties.getFavoriteList().containsKey(favoriteName)) {
            throw new BadRequestException("invalid-favid", "Unknown favorite list: " + favoriteName);
        }
        BiliVideoPayload payload = new BiliVideoPayload(bid.trim(), favoriteName);
        String taskKey = payload.naturalKey().serialize();

        Optional<SyncTask> existing = taskStore.findByKey(taskKey);
        if (existing.isEmpty()) {
            try {
                SyncTask created = taskStore.create(payload);
                log.info("[API] Task {} added to database", taskKey);
                return new Admission(Outcome.CREATED, created);
            } catch (DuplicateTaskException e) {
                log.debug("[API] Task {} created concurrently, updating it instead", taskKey);
                existing = taskStore.findByKey(taskKey);
                if (existing.isEmpty()) {
                    throw e;
                }
            }
        }

        TaskStatus status = existing.get().getStatus();
        boolean requeue = status == TaskStatus.COMPLETED || status == TaskStatus.FAILED;
        SyncTask updated = taskStore.updatePayload(taskKey, payload, requeue)
                .orElseThrow(() -> new NotFoundException("task", taskKey));
        log.info("[API] Task {} was {}, {}", taskKey, status.getValue(), requeue ? "requeued" : "payload updated");
        return new Admission(requeue ? Outcome.REQUEUED : Outcome.UPDATED, updated);
    }

    /**
     * Manual status correction with the same bookkeeping as automatic transitions.
     * Overriding to PENDING also resets the attempt counter.
     */
    public SyncTask overrideStatus(Long id, String status, String errorMessage) {
        TaskStatus target;
        try {
            target = TaskStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("invalid-status", e.getMessage());
        }
        if (target == TaskStatus.FAILED && (errorMessage == null || errorMessage.isBlank())) {
            throw new BadRequestException("missing-error-message", "error_message is required to mark a task failed");
        }
        SyncTask task = taskStore.findById(id).orElseThrow(() -> new NotFoundException("task", String.valueOf(id)));
        Optional<SyncTask> updated = target == TaskStatus.PENDING
                ? taskStore.requeue(task.getTaskKey())
                : taskStore.updateStatus(task.getTaskKey(), target, errorMessage);
        log.info("[API] Task {} status overridden from {} to {}", task.getTaskKey(), task.getStatus().getValue(),
                target.getValue());
        return updated.orElseThrow(() -> new NotFoundException("task", String.valueOf(id)));
    }

    public void delete(Long id) {
        SyncTask task = taskStore.findById(id).orElseThrow(() -> new NotFoundException("task", String.valueOf(id)));
        if (!taskStore.delete(task.getTaskKey())) {
            throw new NotFoundException("task", String.valueOf(id));
        }
        log.info("[API] Task {} deleted", task.getTaskKey());
    }

    public enum Outcome {
        CREATED,
        UPDATED,
        REQUEUED;

        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Value
    public static class Admission {
        Outcome outcome;
        SyncTask task;
    }
}
