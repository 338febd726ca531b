package com.anime.library.catalog.model;

import java.util.Set;

public record ExistingAnimeMatch(Long animeId, String name, Set<Long> fileIds) {
    public ExistingAnimeMatch {
        fileIds = fileIds == null ? Set.of() : Set.copyOf(fileIds);
    }
}
