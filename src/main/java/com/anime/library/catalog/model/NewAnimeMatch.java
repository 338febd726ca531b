package com.anime.library.catalog.model;

import java.util.Set;

public record NewAnimeMatch(AnimeDraft anime, Set<Long> fileIds) {
    public NewAnimeMatch {
        fileIds = fileIds == null ? Set.of() : Set.copyOf(fileIds);
    }
}
