package com.anime.library.catalog.service.info.bangumi;

import java.time.LocalDate;

/**
 * The parts of a Bangumi subject the catalog keeps.
 */
public record BangumiSubject(
        String id,
        String name,
        String nameCn,
        LocalDate date,
        String platform,
        Boolean nsfw
) {
    public String displayName() {
        if (nameCn != null && !nameCn.isBlank()) {
            return nameCn;
        }
        return name;
    }
}
