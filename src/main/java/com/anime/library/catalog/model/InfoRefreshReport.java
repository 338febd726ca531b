package com.anime.library.catalog.model;

import java.time.LocalDateTime;

public record InfoRefreshReport(
        LocalDateTime cutoff,
        int staleSites,
        int refreshed,
        int unsupported,
        int failed,
        int animeTouched
) {
}
