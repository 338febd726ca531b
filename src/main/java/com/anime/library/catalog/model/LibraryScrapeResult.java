package com.anime.library.catalog.model;

import java.util.List;

/**
 * Output of one library scan: files matched to anime that still need to be created,
 * and files matched to anime that already exist in the catalog.
 */
public record LibraryScrapeResult(List<NewAnimeMatch> newAnime, List<ExistingAnimeMatch> existingAnime) {
    public LibraryScrapeResult {
        newAnime = newAnime == null ? List.of() : List.copyOf(newAnime);
        existingAnime = existingAnime == null ? List.of() : List.copyOf(existingAnime);
    }
}
