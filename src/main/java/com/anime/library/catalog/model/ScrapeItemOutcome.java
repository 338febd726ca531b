package com.anime.library.catalog.model;

import java.util.List;

/**
 * Result of applying a single scrape item. A FAILED outcome means the item was skipped;
 * an APPLIED outcome may still carry site errors or a short file count.
 */
public record ScrapeItemOutcome(
        ScrapeItemKind kind,
        String name,
        Long animeId,
        ScrapeItemStatus status,
        int sitesCreated,
        int sitesAlreadyLinked,
        List<String> siteErrors,
        int requestedFiles,
        int linkedFiles,
        String error
) {
    public ScrapeItemOutcome {
        siteErrors = siteErrors == null ? List.of() : List.copyOf(siteErrors);
    }

    public static ScrapeItemOutcome failed(ScrapeItemKind kind, String name, Long animeId, int requestedFiles, String error) {
        return new ScrapeItemOutcome(kind, name, animeId, ScrapeItemStatus.FAILED, 0, 0, List.of(), requestedFiles, 0, error);
    }

    public boolean isApplied() {
        return status == ScrapeItemStatus.APPLIED;
    }
}
