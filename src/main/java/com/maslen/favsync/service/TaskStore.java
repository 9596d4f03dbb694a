package com.maslen.favsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maslen.favsync.dto.PageResult;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.exceptions.DuplicateTaskException;
import com.maslen.favsync.model.TaskKey;
import com.maslen.favsync.model.TaskPayload;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import com.maslen.favsync.repository.SyncTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable task table. Every status change is a single conditional UPDATE keyed by
 * {@code task_key}; the unique index on {@code task_key} decides duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskStore {

    static final int MAX_ERROR_LENGTH = 2000;

    private static final String UNKNOWN_ERROR = "Unknown error";

    private final SyncTaskRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Inserts a PENDING task.
     *
     * @throws DuplicateTaskException when a task with the same natural key exists
     * @throws DataIntegrityViolationException when the row breaks any other constraint
     */
    public SyncTask create(TaskPayload payload) {
        TaskKey key = payload.naturalKey();
        SyncTask task = new SyncTask();
        task.setTaskType(payload.type());
        task.setTaskKey(key.serialize());
        task.setTaskData(writePayload(payload));
        task.setStatus(TaskStatus.PENDING);
        task.setAttempts(0);
        try {
            return repository.saveAndFlush(task);
        } catch (DataIntegrityViolationException e) {
            if (repository.existsByTaskKey(task.getTaskKey())) {
                throw new DuplicateTaskException(task.getTaskKey(), e);
            }
            throw e;
        }
    }

    public Optional<SyncTask> findByKey(String taskKey) {
        return repository.findByTaskKey(taskKey);
    }

    public Optional<SyncTask> findByKey(TaskKey taskKey) {
        return findByKey(taskKey.serialize());
    }

    public Optional<SyncTask> findById(Long id) {
        return repository.findById(id);
    }

    /**
     * Sets the status and keeps the bookkeeping columns consistent with it:
     * {@code completed_at} only on COMPLETED, {@code error_message} only on FAILED.
     *
     * @return the updated task, empty when no task has this key
     */
    public Optional<SyncTask> updateStatus(String taskKey, TaskStatus status, String errorMessage) {
        LocalDateTime now = LocalDateTime.now();
        int updated = repository.updateStatus(taskKey, status, completedAt(status, now),
                errorFor(status, errorMessage), now);
        if (updated == 0) {
            log.debug("[STORE] No task {} to move to {}", taskKey, status);
            return Optional.empty();
        }
        return repository.findByTaskKey(taskKey);
    }

    public Optional<SyncTask> updateStatus(String taskKey, TaskStatus status) {
        return updateStatus(taskKey, status, null);
    }

    /**
     * Moves a task from {@code expected} to {@code target}, with the same bookkeeping
     * as {@link #updateStatus}.
     *
     * @return false when the task is gone or no longer in {@code expected}
     */
    public boolean transition(String taskKey, TaskStatus expected, TaskStatus target, String errorMessage) {
        LocalDateTime now = LocalDateTime.now();
        int updated = repository.transition(taskKey, expected, target, completedAt(target, now),
                errorFor(target, errorMessage), now);
        if (updated == 0) {
            log.debug("[STORE] Task {} is no longer {}, not moving it to {}", taskKey, expected, target);
        }
        return updated == 1;
    }

    /**
     * Records that the claim numbered {@code attempt} actually started running.
     *
     * @return false when the task was changed or claimed again meanwhile
     */
    public boolean markStarted(String taskKey, int attempt) {
        return repository.touch(taskKey, TaskStatus.EXECUTING, attempt, LocalDateTime.now()) == 1;
    }

    /**
     * Stores the outcome of the claim numbered {@code attempt}. Nothing is written
     * when the task left EXECUTING or was claimed again in the meantime.
     */
    public boolean finishAttempt(String taskKey, int attempt, TaskStatus status, String errorMessage) {
        LocalDateTime now = LocalDateTime.now();
        return repository.transitionAttempt(taskKey, TaskStatus.EXECUTING, attempt, status,
                completedAt(status, now), errorFor(status, errorMessage), now) == 1;
    }

    /**
     * PENDING to EXECUTING, only if the task is still PENDING.
     *
     * @return true when this caller won the claim
     */
    public boolean claim(String taskKey) {
        return repository.claim(taskKey, TaskStatus.PENDING, TaskStatus.EXECUTING, LocalDateTime.now()) == 1;
    }

    /**
     * Resets a task to PENDING with a fresh attempt counter.
     */
    public Optional<SyncTask> requeue(String taskKey) {
        if (repository.requeue(taskKey, TaskStatus.PENDING, LocalDateTime.now()) == 0) {
            return Optional.empty();
        }
        return repository.findByTaskKey(taskKey);
    }

    /**
     * Overwrites the payload. With {@code resetToPending} the task also goes back to
     * PENDING with its error and attempt counter cleared.
     */
    public Optional<SyncTask> updatePayload(String taskKey, TaskPayload payload, boolean resetToPending) {
        String data = writePayload(payload);
        LocalDateTime now = LocalDateTime.now();
        int updated = resetToPending
                ? repository.updateTaskDataAndRequeue(taskKey, data, TaskStatus.PENDING, now)
                : repository.updateTaskData(taskKey, data, now);
        if (updated == 0) {
            return Optional.empty();
        }
        return repository.findByTaskKey(taskKey);
    }

    /**
     * PENDING tasks, oldest first.
     *
     * @param limit maximum number of tasks, {@code null} for all
     */
    public List<SyncTask> listPending(Integer limit) {
        Pageable pageable = limit == null ? Pageable.unpaged() : PageRequest.of(0, limit);
        return repository.findByStatusOrderByCreatedAtAscIdAsc(TaskStatus.PENDING, pageable);
    }

    public List<SyncTask> findByStatus(TaskType type, Collection<TaskStatus> statuses) {
        return repository.findByTaskTypeAndStatusIn(type, statuses);
    }

    public List<SyncTask> findStale(TaskStatus status, LocalDateTime updatedBefore) {
        return repository.findByStatusAndUpdatedAtBefore(status, updatedBefore);
    }

    public Map<TaskStatus, Long> stats() {
        Map<TaskStatus, Long> stats = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            stats.put(status, repository.countByStatus(status));
        }
        return stats;
    }

    /**
     * Newest first.
     *
     * @param page 1-based page number
     */
    public PageResult<SyncTask> paginate(int page, int pageSize, TaskStatus statusFilter) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and page size must be positive");
        }
        Pageable pageable = PageRequest.of(page - 1, pageSize,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        Page<SyncTask> result = statusFilter == null
                ? repository.findAll(pageable)
                : repository.findByStatus(statusFilter, pageable);
        return new PageResult<>(result.getContent(), result.getTotalElements(), page, pageSize);
    }

    public boolean delete(String taskKey) {
        return repository.deleteByTaskKey(taskKey) > 0;
    }

    public TaskPayload readPayload(SyncTask task) {
        try {
            return objectMapper.readValue(task.getTaskData(), task.getTaskType().getPayloadClass());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read payload of task " + task.getTaskKey(), e);
        }
    }

    String writePayload(TaskPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize payload " + payload, e);
        }
    }

    private static LocalDateTime completedAt(TaskStatus status, LocalDateTime now) {
        return status == TaskStatus.COMPLETED ? now : null;
    }

    private static String errorFor(TaskStatus status, String errorMessage) {
        return status == TaskStatus.FAILED ? truncateErrorMessage(errorMessage) : null;
    }

    static String truncateErrorMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN_ERROR;
        }
        String collapsed = message.replaceAll("\\s+", " ").trim();
        return collapsed.length() > MAX_ERROR_LENGTH ? collapsed.substring(0, MAX_ERROR_LENGTH) + "..." : collapsed;
    }
}
