package com.maslen.favsync.service;

import com.maslen.favsync.model.CatalogItem;

import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates the videos of the configured favorite lists.
 */
public interface CatalogSource {

    /**
     * Lazily yields every video of every polled favorite list. A list that cannot be
     * loaded is logged and skipped; the others are still yielded.
     */
    Stream<CatalogItem> discover();

    /**
     * bvids of one configured favorite list.
     *
     * @throws IOException when the list cannot be loaded
     */
    List<String> fetch(String favoriteName) throws IOException, InterruptedException;
}
