package com.anime.library.catalog.model;

public enum AnimeInfoSource {
    BANGUMI,
    MYANIMELIST,
    ANILIST
}
