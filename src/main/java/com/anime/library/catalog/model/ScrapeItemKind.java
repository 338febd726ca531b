package com.anime.library.catalog.model;

public enum ScrapeItemKind {
    NEW_ANIME,
    EXISTING_ANIME
}
