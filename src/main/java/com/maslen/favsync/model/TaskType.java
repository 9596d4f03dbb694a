package com.maslen.favsync.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of tasks the store can hold. Each kind names the payload class its
 * {@code task_data} column deserializes to.
 */
public enum TaskType {
    BILI_VIDEO("bili_video", BiliVideoPayload.class);

    private final String value;
    private final Class<? extends TaskPayload> payloadClass;

    TaskType(String value, Class<? extends TaskPayload> payloadClass) {
        this.value = value;
        this.payloadClass = payloadClass;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends TaskPayload> getPayloadClass() {
        return payloadClass;
    }
}
