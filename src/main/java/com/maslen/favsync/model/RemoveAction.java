package com.maslen.favsync.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Removes the video from its favorite list. */
@EqualsAndHashCode
@ToString
public final class RemoveAction implements PostprocessAction {
}
