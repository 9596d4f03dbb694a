package com.maslen.favsync.model;

import lombok.Value;

/** Moves the video to another favorite list. */
@Value
public final class MoveAction implements PostprocessAction {
    String targetFid;
}
