package com.maslen.favsync.model;

import lombok.Value;

@Value
public class VideoInfo {
    String bvid;
    long aid;
    String title;
    /** Number of parts; above one the video is downloaded in batch mode. */
    int parts;
}
