package com.maslen.favsync.model;

/**
 * Step run against the source favorite list after a video was downloaded.
 */
public sealed interface PostprocessAction permits MoveAction, RemoveAction {
}
