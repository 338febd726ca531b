package com.anime.library.catalog.service.info;

import com.anime.library.catalog.model.AnimeSite;
import com.anime.library.catalog.model.InfoRefreshReport;
import com.anime.library.catalog.repository.AnimeSiteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class AnimeInfoRefreshService {
    private final AnimeSiteRepository animeSiteRepository;
    private final AnimeInfoUpdaterRegistry updaterRegistry;

    public AnimeInfoRefreshService(AnimeSiteRepository animeSiteRepository,
                                   AnimeInfoUpdaterRegistry updaterRegistry) {
        this.animeSiteRepository = animeSiteRepository;
        this.updaterRegistry = updaterRegistry;
    }

    /**
     * Refreshes every anime that has a site last updated at or before {@code cutoff}, or never
     * updated. Sites are dispatched one at a time to the updater of their site type; sites
     * without an updater are skipped and a failing site does not stop the scan.
     */
    public InfoRefreshReport updateAllInfo(LocalDateTime cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff is required");
        }
        List<AnimeSite> staleSites = findStaleSites(cutoff);
        log.info("Refreshing {} stale sites (last updated before {})", staleSites.size(), cutoff);

        int refreshed = 0;
        int unsupported = 0;
        int failed = 0;
        int animeTouched = 0;
        for (AnimeSite site : staleSites) {
            Optional<AnimeInfoUpdater> updater = updaterRegistry.find(site.getSiteType());
            if (updater.isEmpty()) {
                log.debug("No info updater for {}, skipping site {}", site.getSiteType(), site.getSiteId());
                unsupported++;
                continue;
            }

            log.info("Updating all anime related to {} {}", site.getSiteType(), site.getSiteId());
            try {
                animeTouched += updater.get().refreshRelatedAnime(site.getSiteId());
                refreshed++;
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException ex) {
                // store unreachable
                throw ex;
            } catch (RuntimeException ex) {
                log.error("Info refresh failed for {} {}: {}", site.getSiteType(), site.getSiteId(), ex.getMessage(), ex);
                failed++;
            }
        }

        log.info("Finished refreshing site info last updated before {}: refreshed={} unsupported={} failed={}",
                cutoff, refreshed, unsupported, failed);
        return new InfoRefreshReport(cutoff, staleSites.size(), refreshed, unsupported, failed, animeTouched);
    }

    List<AnimeSite> findStaleSites(LocalDateTime cutoff) {
        List<Long> animeIds = animeSiteRepository.findAnimeIdsWithStaleSites(cutoff);
        if (animeIds.isEmpty()) {
            return List.of();
        }
        // an anime can have fresh and stale sites at once, so filter per site
        return animeSiteRepository.findAllByAnimeIdIn(animeIds).stream()
                .filter(site -> site.isStale(cutoff))
                .toList();
    }
}
