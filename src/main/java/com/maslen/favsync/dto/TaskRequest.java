package com.maslen.favsync.dto;

import com.maslen.favsync.config.SyncProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {

    private String bid;
    /** Favorite list name; "-1" when the video does not come from a favorite list. */
    private String favid = SyncProperties.NO_FAVORITE;
}
