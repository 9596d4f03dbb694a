package com.maslen.favsync.test;

import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.TaskKey;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.repository.SyncTaskRepository;
import com.maslen.favsync.service.BilibiliClient;
import com.maslen.favsync.service.TaskStore;
import com.maslen.favsync.service.YuttoService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.fail;

/**
 * Full application context on an in-memory H2 database, with the Bilibili API and
 * the yutto binary replaced by mocks. Scheduling is off: tests drive the loops.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class AbstractTest {

    @Autowired
    protected SyncTaskRepository repository;

    @Autowired
    protected TaskStore taskStore;

    @MockBean
    protected BilibiliClient bilibiliClient;

    @MockBean
    protected YuttoService yuttoService;

    @BeforeEach
    public void cleanTasks() {
        repository.deleteAll();
    }

    protected SyncTask task(String bvid, String favid) {
        return taskStore.findByKey(TaskKey.biliVideo(bvid, favid))
                .orElseThrow(() -> new AssertionError("No task " + bvid + " in " + favid));
    }

    /** Waits until the task reaches one of the given statuses. */
    protected SyncTask awaitStatus(String bvid, String favid, Duration timeout, TaskStatus... expected)
            throws InterruptedException {
        Set<TaskStatus> statuses = Set.of(expected);
        long deadline = System.nanoTime() + timeout.toNanos();
        SyncTask current = task(bvid, favid);
        while (!statuses.contains(current.getStatus())) {
            if (System.nanoTime() > deadline) {
                fail("Task " + bvid + " still " + current.getStatus() + " after " + timeout);
            }
            Thread.sleep(50);
            current = task(bvid, favid);
        }
        return current;
    }
}
