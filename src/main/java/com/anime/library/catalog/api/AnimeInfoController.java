package com.anime.library.catalog.api;

import com.anime.library.catalog.model.InfoRefreshReport;
import com.anime.library.catalog.service.info.AnimeInfoRefreshService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/anime-info")
public class AnimeInfoController {
    private final AnimeInfoRefreshService animeInfoRefreshService;
    private final Duration maxAge;

    public AnimeInfoController(AnimeInfoRefreshService animeInfoRefreshService,
                               @Value("${app.info-refresh.max-age:P7D}") Duration maxAge) {
        this.animeInfoRefreshService = animeInfoRefreshService;
        this.maxAge = maxAge;
    }

    @PostMapping("/refresh")
    public InfoRefreshReport refresh(@RequestParam(name = "before", required = false) String before) {
        LocalDateTime cutoff = before == null || before.isBlank()
                ? LocalDateTime.now().minus(maxAge)
                : LocalDateTime.parse(before);
        return animeInfoRefreshService.updateAllInfo(cutoff);
    }
}
