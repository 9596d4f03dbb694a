package com.maslen.favsync.service.handler;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.model.BiliVideoPayload;
import com.maslen.favsync.model.VideoInfo;
import com.maslen.favsync.service.BilibiliClient;
import com.maslen.favsync.service.YuttoService;
import com.maslen.favsync.util.PathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Downloads one Bilibili video into its favorite list's destination, then runs the
 * list's postprocess actions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BiliVideoTaskHandler {

    private final SyncProperties properties;
    private final BilibiliClient bilibiliClient;
    private final YuttoService yuttoService;
    private final PostprocessHandler postprocessHandler;

    public void handle(BiliVideoPayload payload) throws IOException, InterruptedException {
        String bid = payload.getBid();
        SyncProperties.FavoriteList favoriteList = properties.favoriteListOrDefault(payload.getTaskName());
        Path downloadPath = PathUtils.formatDownloadPath(favoriteList.getPath(), LocalDateTime.now());

        Optional<VideoInfo> info = bilibiliClient.getVideoInfo(bid);
        if (info.isEmpty()) {
            log.info("[HANDLER] Failed to get video info for {}, nothing to download", bid);
            return;
        }
        VideoInfo video = info.get();
        boolean batch = video.getParts() > 1;
        if (batch) {
            log.info("[HANDLER] Video {} has {} parts, using batch mode", bid, video.getParts());
        }

        yuttoService.download(bid, downloadPath, batch, favoriteList.getName());
        postprocessHandler.apply(favoriteList, video);
    }
}
