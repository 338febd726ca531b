package com.anime.library.catalog.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Anime proposed by the library scraper, not yet persisted.
 */
public record AnimeDraft(
        String name,
        String originalName,
        boolean bdrip,
        boolean nsfw,
        String platform,
        LocalDate date,
        Integer releaseYear,
        ReleaseSeason releaseSeason,
        String region,
        List<SiteRef> sites
) {
    public AnimeDraft {
        sites = sites == null ? List.of() : List.copyOf(sites);
    }

    public Anime toAnime() {
        Anime anime = new Anime(name);
        anime.setOriginalName(originalName);
        anime.setBdrip(bdrip);
        anime.setNsfw(nsfw);
        anime.setPlatform(platform);
        anime.setDate(date);
        anime.setReleaseYear(releaseYear);
        anime.setReleaseSeason(releaseSeason);
        anime.setRegion(region);
        return anime;
    }
}
