package com.maslen.favsync.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusOverrideRequest {

    private String status;
    private String errorMessage;
}
