package com.maslen.favsync.service;

import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.VideoInfo;
import com.maslen.favsync.test.AbstractTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TestTaskExecution extends AbstractTest {

    @Autowired
    private TaskExecutionService executionService;

    @Autowired
    private ConcurrencyLimiter limiter;

    @BeforeEach
    void videoExists() throws Exception {
        when(bilibiliClient.getVideoInfo(any())).thenAnswer(invocation ->
                Optional.of(new VideoInfo(invocation.getArgument(0), 42L, "title", 1)));
    }

    private SyncTask claimed(String bvid, String favid) {
        SyncTask task = taskStore.create(new BiliVideoPayload(bvid, favid));
        assertThat(taskStore.claim(task.getTaskKey())).isTrue();
        return task(bvid, favid);
    }

    @Test
    void successfulDownloadCompletesTask() throws Exception {
        SyncTask task = claimed("BV1", "fav1");

        TaskStatus status = executionService.submit(task).get(10, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(TaskStatus.COMPLETED);
        SyncTask stored = task("BV1", "fav1");
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(stored.getCompletedAt()).isNotNull();
        assertThat(stored.getErrorMessage()).isNull();
        verify(yuttoService).download(eq("BV1"), eq(Path.of("target/test-downloads/fav1/")), eq(false), isNull());
        assertThat(limiter.inUse()).isZero();
    }

    @Test
    void multiPartVideoUsesBatchMode() throws Exception {
        when(bilibiliClient.getVideoInfo("BV2")).thenReturn(Optional.of(new VideoInfo("BV2", 7L, "parts", 3)));
        SyncTask task = claimed("BV2", "fav1");

        assertThat(executionService.submit(task).get(10, TimeUnit.SECONDS)).isEqualTo(TaskStatus.COMPLETED);
        verify(yuttoService).download(eq("BV2"), any(), eq(true), isNull());
    }

    @Test
    void unavailableVideoCompletesWithoutDownload() throws Exception {
        when(bilibiliClient.getVideoInfo("BV3")).thenReturn(Optional.empty());
        SyncTask task = claimed("BV3", "fav1");

        assertThat(executionService.submit(task).get(10, TimeUnit.SECONDS)).isEqualTo(TaskStatus.COMPLETED);
        verify(yuttoService, never()).download(any(), any(), anyBoolean(), any());
    }

    @Test
    void downloadErrorFailsTask() throws Exception {
        doThrow(new IOException("yutto exited with code 1 for BV1"))
                .when(yuttoService).download(eq("BV1"), any(), anyBoolean(), any());
        SyncTask task = claimed("BV1", "fav1");

        TaskStatus status = executionService.submit(task).get(10, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(TaskStatus.FAILED);
        SyncTask stored = task("BV1", "fav1");
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(stored.getErrorMessage()).startsWith("Error processing task").contains("yutto exited with code 1");
        assertThat(stored.getCompletedAt()).isNull();
        assertThat(limiter.inUse()).isZero();
    }

    @Test
    void postprocessRunsAfterDownload() throws Exception {
        SyncTask task = claimed("BV4", "fav2");

        assertThat(executionService.submit(task).get(10, TimeUnit.SECONDS)).isEqualTo(TaskStatus.COMPLETED);
        verify(bilibiliClient).moveResource("1002", "2002", 42L);
        verify(bilibiliClient).removeResource("1002", 42L);
    }

    @Test
    void slowDownloadTimesOut() throws Exception {
        AtomicInteger interrupted = new AtomicInteger();
        doAnswer(invocation -> {
            try {
                Thread.sleep(TimeUnit.SECONDS.toMillis(30));
            } catch (InterruptedException e) {
                interrupted.incrementAndGet();
                throw e;
            }
            return null;
        }).when(yuttoService).download(eq("BV5"), any(), anyBoolean(), any());
        SyncTask task = claimed("BV5", "fav1");

        long start = System.nanoTime();
        TaskStatus status = executionService.submit(task).get(20, TimeUnit.SECONDS);
        long elapsed = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start);

        assertThat(status).isEqualTo(TaskStatus.FAILED);
        assertThat(elapsed).isLessThan(10);
        assertThat(task("BV5", "fav1").getErrorMessage()).contains("timed out after 2s");
        assertThat(limiter.inUse()).isZero();
        Thread.sleep(200);
        assertThat(interrupted.get()).isEqualTo(1);
    }

    @Test
    void neverMoreThanMaxConcurrentTasks() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        doAnswer(invocation -> {
            int now = running.incrementAndGet();
            maxRunning.accumulateAndGet(now, Math::max);
            Thread.sleep(200);
            running.decrementAndGet();
            return null;
        }).when(yuttoService).download(any(), any(), anyBoolean(), any());

        List<CompletableFuture<TaskStatus>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(executionService.submit(claimed("BVC" + i, "fav1")));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(20, TimeUnit.SECONDS);

        assertThat(futures).allSatisfy(f -> assertThat(f.join()).isEqualTo(TaskStatus.COMPLETED));
        assertThat(maxRunning.get()).isBetween(1, limiter.getMaxPermits());
        assertThat(limiter.inUse()).isZero();
    }

    @Test
    void unreadablePayloadFailsImmediately() throws Exception {
        SyncTask task = claimed("BV6", "fav1");
        task.setTaskData("{not json");

        assertThat(executionService.submit(task).get(5, TimeUnit.SECONDS)).isEqualTo(TaskStatus.FAILED);
        assertThat(task("BV6", "fav1").getErrorMessage()).startsWith("Unreadable task payload");
    }

    @Test
    void limiterUsesConfiguredPermits() {
        assertThat(limiter.getMaxPermits()).isEqualTo(2);
        assertThat(limiter.inUse()).isZero();
    }

    @Test
    void statusChangedWhileRunningIsKept() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(yuttoService).download(eq("BV7"), any(), anyBoolean(), any());
        SyncTask task = claimed("BV7", "fav1");

        CompletableFuture<TaskStatus> result = executionService.submit(task);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(executionService.isInFlight(task.getTaskKey())).isTrue();
        taskStore.updateStatus(task.getTaskKey(), TaskStatus.FAILED, "stopped by hand");
        release.countDown();
        result.get(10, TimeUnit.SECONDS);

        SyncTask stored = task("BV7", "fav1");
        assertThat(stored.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("stopped by hand");
        assertThat(executionService.isInFlight(task.getTaskKey())).isFalse();
    }

    @Test
    void outdatedClaimIsNotRun() throws Exception {
        SyncTask task = claimed("BV8", "fav1");
        task.setAttempts(task.getAttempts() - 1);

        TaskStatus status = executionService.submit(task).get(10, TimeUnit.SECONDS);

        assertThat(status).isEqualTo(TaskStatus.EXECUTING);
        verify(yuttoService, never()).download(eq("BV8"), any(), anyBoolean(), any());
        assertThat(limiter.inUse()).isZero();
    }
}
