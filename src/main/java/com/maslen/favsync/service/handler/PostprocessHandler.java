package com.maslen.favsync.service.handler;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.model.MoveAction;
import com.maslen.favsync.model.PostprocessAction;
import com.maslen.favsync.model.RemoveAction;
import com.maslen.favsync.model.VideoInfo;
import com.maslen.favsync.service.BilibiliClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Applies the postprocess actions of a favorite list to a downloaded video, in
 * configured order. The first failing action stops the chain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostprocessHandler {

    private final BilibiliClient bilibiliClient;

    public void apply(SyncProperties.FavoriteList favoriteList, VideoInfo video)
            throws IOException, InterruptedException {
        for (PostprocessAction action : favoriteList.actions()) {
            apply(action, favoriteList.getFid(), video);
        }
    }

    void apply(PostprocessAction action, String sourceFid, VideoInfo video)
            throws IOException, InterruptedException {
        if (action instanceof MoveAction move) {
            bilibiliClient.moveResource(sourceFid, move.getTargetFid(), video.getAid());
            log.info("[POSTPROCESS] Moved {} from favorite list {} to {}", video.getBvid(), sourceFid,
                    move.getTargetFid());
        } else if (action instanceof RemoveAction) {
            bilibiliClient.removeResource(sourceFid, video.getAid());
            log.info("[POSTPROCESS] Removed {} from favorite list {}", video.getBvid(), sourceFid);
        } else {
            throw new IllegalStateException("Unsupported postprocess action: " + action);
        }
    }
}
