package com.maslen.favsync.service;

import com.maslen.favsync.dto.PageResult;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.exceptions.DuplicateTaskException;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import com.maslen.favsync.test.AbstractTest;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestTaskStore extends AbstractTest {

    @Test
    void createStoresPendingTask() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        assertThat(task.getId()).isNotNull();
        assertThat(task.getTaskType()).isEqualTo(TaskType.BILI_VIDEO);
        assertThat(task.getTaskKey()).isEqualTo("{\"bvid\":\"BV1\",\"favid\":\"fav1\"}");
        assertThat(task.getTaskData()).contains("\"bid\":\"BV1\"").contains("\"task_name\":\"fav1\"");
        assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.getAttempts()).isZero();
        assertThat(task.getCompletedAt()).isNull();
        assertThat(task.getErrorMessage()).isNull();
    }

    @Test
    void duplicateKeyIsRejected() {
        taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        assertThatThrownBy(() -> taskStore.create(new BiliVideoPayload("BV1", "fav1")))
                .isInstanceOf(DuplicateTaskException.class);
        assertThat(repository.count()).isEqualTo(1);

        // same video in another favorite list is a different task
        taskStore.create(new BiliVideoPayload("BV1", "fav2"));
        assertThat(repository.count()).isEqualTo(2);
    }

    @Test
    void completedAtOnlyWhileCompleted() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        SyncTask completed = taskStore.updateStatus(task.getTaskKey(), TaskStatus.COMPLETED).orElseThrow();
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getErrorMessage()).isNull();

        SyncTask pending = taskStore.updateStatus(task.getTaskKey(), TaskStatus.PENDING).orElseThrow();
        assertThat(pending.getCompletedAt()).isNull();
    }

    @Test
    void errorMessageOnlyWhileFailed() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        SyncTask failed = taskStore.updateStatus(task.getTaskKey(), TaskStatus.FAILED, "network down").orElseThrow();
        assertThat(failed.getErrorMessage()).isEqualTo("network down");
        assertThat(failed.getCompletedAt()).isNull();

        SyncTask pending = taskStore.updateStatus(task.getTaskKey(), TaskStatus.PENDING, "ignored").orElseThrow();
        assertThat(pending.getErrorMessage()).isNull();
    }

    @Test
    void failedWithoutMessageGetsPlaceholder() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        SyncTask failed = taskStore.updateStatus(task.getTaskKey(), TaskStatus.FAILED, "  ").orElseThrow();
        assertThat(failed.getErrorMessage()).isEqualTo("Unknown error");
    }

    @Test
    void longErrorMessageIsTruncated() {
        String message = "x".repeat(5000);
        assertThat(TaskStore.truncateErrorMessage(message)).hasSize(TaskStore.MAX_ERROR_LENGTH + 3).endsWith("...");
        assertThat(TaskStore.truncateErrorMessage("line one\n\tline two")).isEqualTo("line one line two");
    }

    @Test
    void updateStatusOfUnknownKeyIsEmpty() {
        assertThat(taskStore.updateStatus("{\"bvid\":\"nope\",\"favid\":\"fav1\"}", TaskStatus.COMPLETED)).isEmpty();
    }

    @Test
    void claimSucceedsOnlyOnce() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        assertThat(taskStore.claim(task.getTaskKey())).isTrue();
        assertThat(taskStore.claim(task.getTaskKey())).isFalse();

        SyncTask claimed = task("BV1", "fav1");
        assertThat(claimed.getStatus()).isEqualTo(TaskStatus.EXECUTING);
        assertThat(claimed.getAttempts()).isEqualTo(1);
    }

    @Test
    void listPendingIsOldestFirst() {
        taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.create(new BiliVideoPayload("BV2", "fav1"));
        taskStore.create(new BiliVideoPayload("BV3", "fav1"));
        taskStore.claim(task("BV2", "fav1").getTaskKey());

        List<SyncTask> pending = taskStore.listPending(null);
        assertThat(pending).extracting(t -> taskStore.readPayload(t)).extracting("bid").containsExactly("BV1", "BV3");
        assertThat(taskStore.listPending(1)).hasSize(1);
    }

    @Test
    void paginate() {
        for (int i = 0; i < 25; i++) {
            taskStore.create(new BiliVideoPayload("BV" + i, "fav1"));
        }

        PageResult<SyncTask> first = taskStore.paginate(1, 10, null);
        assertThat(first.getItems()).hasSize(10);
        assertThat(first.getTotal()).isEqualTo(25);
        assertThat(first.getItems().get(0).getTaskKey()).contains("BV24");

        PageResult<SyncTask> last = taskStore.paginate(3, 10, null);
        assertThat(last.getItems()).hasSize(5);
        assertThat(last.getPage()).isEqualTo(3);

        taskStore.updateStatus(task("BV3", "fav1").getTaskKey(), TaskStatus.FAILED, "boom");
        PageResult<SyncTask> failed = taskStore.paginate(1, 10, TaskStatus.FAILED);
        assertThat(failed.getTotal()).isEqualTo(1);
        assertThat(failed.getItems()).extracting(SyncTask::getErrorMessage).containsExactly("boom");
    }

    @Test
    void statsCountEveryStatus() {
        taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.create(new BiliVideoPayload("BV2", "fav1"));
        taskStore.create(new BiliVideoPayload("BV3", "fav1"));
        taskStore.updateStatus(task("BV3", "fav1").getTaskKey(), TaskStatus.COMPLETED);

        Map<TaskStatus, Long> stats = taskStore.stats();
        assertThat(stats).containsEntry(TaskStatus.PENDING, 2L)
                .containsEntry(TaskStatus.COMPLETED, 1L)
                .containsEntry(TaskStatus.EXECUTING, 0L)
                .containsEntry(TaskStatus.FAILED, 0L);
    }

    @Test
    void updatePayloadWithReset() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.claim(task.getTaskKey());
        taskStore.updateStatus(task.getTaskKey(), TaskStatus.FAILED, "boom");

        SyncTask kept = taskStore.updatePayload(task.getTaskKey(), new BiliVideoPayload("BV1", "fav1"), false)
                .orElseThrow();
        assertThat(kept.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(kept.getAttempts()).isEqualTo(1);

        SyncTask reset = taskStore.updatePayload(task.getTaskKey(), new BiliVideoPayload("BV1", "fav1"), true)
                .orElseThrow();
        assertThat(reset.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(reset.getAttempts()).isZero();
        assertThat(reset.getErrorMessage()).isNull();
    }

    @Test
    void delete() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));

        assertThat(taskStore.delete(task.getTaskKey())).isTrue();
        assertThat(taskStore.delete(task.getTaskKey())).isFalse();
        assertThat(taskStore.findById(task.getId())).isEmpty();
    }

    @Test
    void oversizedKeyIsNotReportedAsDuplicate() {
        String longBvid = "BV" + "x".repeat(600);

        assertThatThrownBy(() -> taskStore.create(new BiliVideoPayload(longBvid, "fav1")))
                .isInstanceOf(DataIntegrityViolationException.class)
                .isNotInstanceOf(DuplicateTaskException.class);
        assertThat(repository.count()).isZero();
    }

    @Test
    void transitionOnlyFromExpectedStatus() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.updateStatus(task.getTaskKey(), TaskStatus.COMPLETED);

        assertThat(taskStore.transition(task.getTaskKey(), TaskStatus.FAILED, TaskStatus.PENDING, null)).isFalse();
        assertThat(task("BV1", "fav1").getStatus()).isEqualTo(TaskStatus.COMPLETED);

        taskStore.updateStatus(task.getTaskKey(), TaskStatus.FAILED, "boom");
        assertThat(taskStore.transition(task.getTaskKey(), TaskStatus.FAILED, TaskStatus.PENDING, null)).isTrue();
        SyncTask pending = task("BV1", "fav1");
        assertThat(pending.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(pending.getErrorMessage()).isNull();
    }

    @Test
    void finishOnlyForTheCurrentClaim() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.claim(task.getTaskKey());

        assertThat(taskStore.finishAttempt(task.getTaskKey(), 0, TaskStatus.COMPLETED, null)).isFalse();
        assertThat(task("BV1", "fav1").getStatus()).isEqualTo(TaskStatus.EXECUTING);

        assertThat(taskStore.finishAttempt(task.getTaskKey(), 1, TaskStatus.FAILED, "boom")).isTrue();
        assertThat(task("BV1", "fav1").getErrorMessage()).isEqualTo("boom");
        // already finished
        assertThat(taskStore.finishAttempt(task.getTaskKey(), 1, TaskStatus.COMPLETED, null)).isFalse();
        assertThat(task("BV1", "fav1").getStatus()).isEqualTo(TaskStatus.FAILED);
    }

    @Test
    void markStartedTouchesTheClaimedTask() {
        SyncTask task = taskStore.create(new BiliVideoPayload("BV1", "fav1"));
        taskStore.claim(task.getTaskKey());
        LocalDateTime claimedAt = LocalDateTime.now().minusHours(1);
        repository.updateStatus(task.getTaskKey(), TaskStatus.EXECUTING, null, null, claimedAt);

        assertThat(taskStore.markStarted(task.getTaskKey(), 2)).isFalse();
        assertThat(task("BV1", "fav1").getUpdatedAt()).isBefore(LocalDateTime.now().minusMinutes(59));

        assertThat(taskStore.markStarted(task.getTaskKey(), 1)).isTrue();
        assertThat(task("BV1", "fav1").getUpdatedAt()).isAfter(claimedAt.plusMinutes(59));
    }
}
