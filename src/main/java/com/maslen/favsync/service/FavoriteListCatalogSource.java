package com.maslen.favsync.service;

import com.maslen.favsync.config.SyncProperties;
import com.maslen.favsync.model.CatalogItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class FavoriteListCatalogSource implements CatalogSource {

    private final SyncProperties properties;
    private final BilibiliClient bilibiliClient;

    @Override
    public Stream<CatalogItem> discover() {
        return properties.polledFavoriteLists().keySet().stream()
                .flatMap(name -> fetchOrSkip(name).stream().map(bvid -> new CatalogItem(bvid, name)));
    }

    @Override
    public List<String> fetch(String favoriteName) throws IOException, InterruptedException {
        SyncProperties.FavoriteList list = properties.getFavoriteList().get(favoriteName);
        if (list == null) {
            throw new IOException("Favorite list " + favoriteName + " is not configured");
        }
        return bilibiliClient.listFavoriteIds(list.getFid());
    }

    private List<String> fetchOrSkip(String favoriteName) {
        try {
            return fetch(favoriteName);
        } catch (IOException e) {
            log.error("[CATALOG] Failed to fetch favorite list {}, skipping it this cycle: {}", favoriteName,
                    e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[CATALOG] Interrupted while fetching favorite list {}", favoriteName);
            return List.of();
        }
    }
}
