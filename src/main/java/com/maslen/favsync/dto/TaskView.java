package com.maslen.favsync.dto;

import com.maslen.favsync.entity.SyncTask;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskView {

    private Long id;
    private TaskType taskType;
    private String taskKey;
    private String taskData;
    private TaskStatus status;
    private int attempts;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
    private String errorMessage;

    public static TaskView of(SyncTask task) {
        return new TaskView(task.getId(), task.getTaskType(), task.getTaskKey(), task.getTaskData(),
                task.getStatus(), task.getAttempts(), task.getCreatedAt(), task.getUpdatedAt(),
                task.getCompletedAt(), task.getErrorMessage());
    }
}
