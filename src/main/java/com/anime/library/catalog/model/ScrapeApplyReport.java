package com.anime.library.catalog.model;

import java.util.List;

public record ScrapeApplyReport(
        int newAnimeCreated,
        int existingAnimeLinked,
        int failed,
        int filesLinked,
        List<ScrapeItemOutcome> items
) {
    public static ScrapeApplyReport from(List<ScrapeItemOutcome> items) {
        int created = 0;
        int linked = 0;
        int failed = 0;
        int files = 0;
        for (ScrapeItemOutcome item : items) {
            // a new anime whose files could not be linked is FAILED but still exists
            if (item.kind() == ScrapeItemKind.NEW_ANIME && item.animeId() != null) {
                created++;
            }
            if (!item.isApplied()) {
                failed++;
                continue;
            }
            if (item.kind() == ScrapeItemKind.EXISTING_ANIME) {
                linked++;
            }
            files += item.linkedFiles();
        }
        return new ScrapeApplyReport(created, linked, failed, files, List.copyOf(items));
    }
}
