package com.maslen.favsync.service;

import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.VideoInfo;
import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.test.AbstractTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TestTaskConsumer extends AbstractTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @Autowired
    private TaskProducer producer;

    @Autowired
    private TaskConsumer consumer;

    @Test
    void favoriteVideoIsDownloadedOnce() throws Exception {
        when(bilibiliClient.listFavoriteIds("1001")).thenReturn(List.of("BV1"));
        when(bilibiliClient.listFavoriteIds("1002")).thenReturn(List.of());
        when(bilibiliClient.getVideoInfo("BV1")).thenReturn(Optional.of(new VideoInfo("BV1", 1L, "t", 1)));

        producer.runCycle();
        assertThat(consumer.pollOnce()).isEqualTo(1);
        SyncTask done = awaitStatus("BV1", "fav1", WAIT, TaskStatus.COMPLETED, TaskStatus.FAILED);

        assertThat(done.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(done.getCompletedAt()).isNotNull();

        producer.runCycle();
        assertThat(consumer.pollOnce()).isZero();
        assertThat(repository.count()).isEqualTo(1);
        verify(yuttoService, times(1)).download(eq("BV1"), any(), anyBoolean(), any());
    }

    @Test
    void failedDownloadIsRetriedOnNextCycle() throws Exception {
        when(bilibiliClient.listFavoriteIds("1001")).thenReturn(List.of("BV1"));
        when(bilibiliClient.listFavoriteIds("1002")).thenReturn(List.of());
        when(bilibiliClient.getVideoInfo("BV1")).thenReturn(Optional.of(new VideoInfo("BV1", 1L, "t", 1)));
        doThrow(new IOException("network unreachable")).when(yuttoService).download(eq("BV1"), any(), anyBoolean(),
                any());

        producer.runCycle();
        consumer.pollOnce();
        SyncTask failed = awaitStatus("BV1", "fav1", WAIT, TaskStatus.FAILED, TaskStatus.COMPLETED);
        assertThat(failed.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(failed.getErrorMessage()).contains("network unreachable");

        producer.runCycle();
        assertThat(task("BV1", "fav1").getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(task("BV1", "fav1").getErrorMessage()).isNull();
    }

    @Test
    void pendingTaskIsDispatchedOnlyOnce() throws Exception {
        when(bilibiliClient.getVideoInfo(any())).thenReturn(Optional.empty());
        taskStore.create(new BiliVideoPayload("BV1", "-1"));
        taskStore.create(new BiliVideoPayload("BV2", "-1"));

        int first = consumer.pollOnce();
        int second = consumer.pollOnce();

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        awaitStatus("BV1", "-1", WAIT, TaskStatus.COMPLETED);
        awaitStatus("BV2", "-1", WAIT, TaskStatus.COMPLETED);
        assertThat(task("BV1", "-1").getAttempts()).isEqualTo(1);
    }
}
