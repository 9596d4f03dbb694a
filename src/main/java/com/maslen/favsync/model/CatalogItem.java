package com.maslen.favsync.model;

import lombok.Value;

/** One video found in one configured favorite list. */
@Value
public class CatalogItem {
    String bvid;
    String favoriteName;
}
