package com.maslen.favsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public final class BiliVideoPayload implements TaskPayload {

    @JsonProperty("bid")
    private String bid;

    /** Name of the favorite list entry in the configuration, "-1" for API submissions. */
    @JsonProperty("task_name")
    private String taskName;

    @Override
    public TaskType type() {
        return TaskType.BILI_VIDEO;
    }

    @Override
    public TaskKey naturalKey() {
        return TaskKey.biliVideo(bid, taskName);
    }
}
