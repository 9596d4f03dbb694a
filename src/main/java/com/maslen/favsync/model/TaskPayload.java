package com.maslen.favsync.model;

/**
 * Serialized context of a task, one implementation per {@link TaskType}.
 */
public sealed interface TaskPayload permits BiliVideoPayload {

    TaskType type();

    /** Natural key the task is deduplicated on. */
    TaskKey naturalKey();
}
