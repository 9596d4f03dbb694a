package com.maslen.favsync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResponse {

    /** created, updated or requeued. */
    private String status;
    private String message;
    private TaskView task;
}
