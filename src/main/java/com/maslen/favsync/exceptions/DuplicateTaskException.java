package com.maslen.favsync.exceptions;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A task with the same {@code task_key} already exists.
 */
@Getter
public class DuplicateTaskException extends FavSyncException {

    private static final long serialVersionUID = 1L;

    private final String taskKey;

    public DuplicateTaskException(String taskKey, Throwable cause) {
        super(HttpStatus.CONFLICT, "task-exists", "Task already exists: " + taskKey);
        this.taskKey = taskKey;
        initCause(cause);
    }
}
