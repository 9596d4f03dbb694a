package com.maslen.favsync.repository;

import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SyncTaskRepository extends JpaRepository<SyncTask, Long> {

    Optional<SyncTask> findByTaskKey(String taskKey);

    List<SyncTask> findByStatusOrderByCreatedAtAscIdAsc(TaskStatus status, Pageable pageable);

    List<SyncTask> findByTaskTypeAndStatusIn(TaskType taskType, Collection<TaskStatus> statuses);

    List<SyncTask> findByStatusAndUpdatedAtBefore(TaskStatus status, LocalDateTime dateTime);

    Page<SyncTask> findByStatus(TaskStatus status, Pageable pageable);

    long countByStatus(TaskStatus status);

    boolean existsByTaskKey(String taskKey);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.status = :status, t.completedAt = :completedAt, "
            + "t.errorMessage = :errorMessage, t.updatedAt = :now where t.taskKey = :taskKey")
    int updateStatus(@Param("taskKey") String taskKey,
            @Param("status") TaskStatus status,
            @Param("completedAt") LocalDateTime completedAt,
            @Param("errorMessage") String errorMessage,
            @Param("now") LocalDateTime now);

    /**
     * Moves a row from {@code expected} to {@code target} only if it is still in
     * {@code expected}; returns the number of rows changed (0 or 1).
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.status = :target, t.attempts = t.attempts + 1, t.completedAt = null, "
            + "t.errorMessage = null, t.updatedAt = :now where t.taskKey = :taskKey and t.status = :expected")
    int claim(@Param("taskKey") String taskKey,
            @Param("expected") TaskStatus expected,
            @Param("target") TaskStatus target,
            @Param("now") LocalDateTime now);

    /**
     * Same as {@link #updateStatus} but only while the row is still in {@code expected}.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.status = :target, t.completedAt = :completedAt, "
            + "t.errorMessage = :errorMessage, t.updatedAt = :now "
            + "where t.taskKey = :taskKey and t.status = :expected")
    int transition(@Param("taskKey") String taskKey,
            @Param("expected") TaskStatus expected,
            @Param("target") TaskStatus target,
            @Param("completedAt") LocalDateTime completedAt,
            @Param("errorMessage") String errorMessage,
            @Param("now") LocalDateTime now);

    /**
     * Ends one claim of a task: the row must still be in {@code expected} with the
     * attempt counter that claim produced.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.status = :target, t.completedAt = :completedAt, "
            + "t.errorMessage = :errorMessage, t.updatedAt = :now "
            + "where t.taskKey = :taskKey and t.status = :expected and t.attempts = :attempts")
    int transitionAttempt(@Param("taskKey") String taskKey,
            @Param("expected") TaskStatus expected,
            @Param("attempts") int attempts,
            @Param("target") TaskStatus target,
            @Param("completedAt") LocalDateTime completedAt,
            @Param("errorMessage") String errorMessage,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.updatedAt = :now "
            + "where t.taskKey = :taskKey and t.status = :expected and t.attempts = :attempts")
    int touch(@Param("taskKey") String taskKey,
            @Param("expected") TaskStatus expected,
            @Param("attempts") int attempts,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.taskData = :taskData, t.updatedAt = :now where t.taskKey = :taskKey")
    int updateTaskData(@Param("taskKey") String taskKey,
            @Param("taskData") String taskData,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.taskData = :taskData, t.status = :pending, t.attempts = 0, "
            + "t.completedAt = null, t.errorMessage = null, t.updatedAt = :now where t.taskKey = :taskKey")
    int updateTaskDataAndRequeue(@Param("taskKey") String taskKey,
            @Param("taskData") String taskData,
            @Param("pending") TaskStatus pending,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncTask t set t.status = :pending, t.attempts = 0, t.completedAt = null, "
            + "t.errorMessage = null, t.updatedAt = :now where t.taskKey = :taskKey")
    int requeue(@Param("taskKey") String taskKey,
            @Param("pending") TaskStatus pending,
            @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from SyncTask t where t.taskKey = :taskKey")
    int deleteByTaskKey(@Param("taskKey") String taskKey);
}
