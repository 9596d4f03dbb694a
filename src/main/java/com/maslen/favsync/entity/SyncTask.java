package com.maslen.favsync.entity;

import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.model.TaskType;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "tasks",
        uniqueConstraints = @UniqueConstraint(name = "ux_tasks_task_key", columnNames = { "task_key" }),
        indexes = {
                @Index(name = "ix_tasks_task_type", columnList = "task_type"),
                @Index(name = "ix_tasks_status", columnList = "status"),
                @Index(name = "ix_tasks_created_at", columnList = "created_at")
        })
@Data
public class SyncTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 50)
    private TaskType taskType;

    @Column(name = "task_key", nullable = false, length = 500)
    private String taskKey;

    @Column(name = "task_data", nullable = false, length = 8192)
    private String taskData;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "error_message", length = 2048)
    private String errorMessage;
}
