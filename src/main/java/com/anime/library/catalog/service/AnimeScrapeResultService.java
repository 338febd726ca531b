package com.anime.library.catalog.service;

import com.anime.library.catalog.model.Anime;
import com.anime.library.catalog.model.AnimeDraft;
import com.anime.library.catalog.model.ExistingAnimeMatch;
import com.anime.library.catalog.model.LibraryScrapeResult;
import com.anime.library.catalog.model.NewAnimeMatch;
import com.anime.library.catalog.model.ScrapeApplyReport;
import com.anime.library.catalog.model.ScrapeItemKind;
import com.anime.library.catalog.model.ScrapeItemOutcome;
import com.anime.library.catalog.model.ScrapeItemStatus;
import com.anime.library.catalog.model.SiteLinkResult;
import com.anime.library.catalog.model.SiteRef;
import com.anime.library.catalog.repository.AnimeRepository;
import com.anime.library.catalog.repository.LibFileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Applies a {@link LibraryScrapeResult} to the catalog. Every item is applied on its own:
 * a failing item is reported and skipped, it never rolls back or stops the rest of the batch.
 * Only an unreachable store ({@link DataAccessResourceFailureException}) ends the run.
 */
@Slf4j
@Service
public class AnimeScrapeResultService {
    private final AnimeRepository animeRepository;
    private final LibFileRepository libFileRepository;
    private final AnimeSiteService animeSiteService;
    private final TransactionTemplate transactionTemplate;

    public AnimeScrapeResultService(AnimeRepository animeRepository,
                                    LibFileRepository libFileRepository,
                                    AnimeSiteService animeSiteService,
                                    PlatformTransactionManager transactionManager) {
        this.animeRepository = animeRepository;
        this.libFileRepository = libFileRepository;
        this.animeSiteService = animeSiteService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public ScrapeApplyReport applyLibraryScrapeResult(LibraryScrapeResult result) {
        List<ScrapeItemOutcome> outcomes = new ArrayList<>();
        for (NewAnimeMatch match : result.newAnime()) {
            outcomes.add(applyNewAnime(match));
        }
        for (ExistingAnimeMatch match : result.existingAnime()) {
            outcomes.add(applyExistingAnime(match));
        }

        ScrapeApplyReport report = ScrapeApplyReport.from(outcomes);
        log.info("Scrape result applied: created={} linkedExisting={} failed={} files={}",
                report.newAnimeCreated(), report.existingAnimeLinked(), report.failed(), report.filesLinked());
        return report;
    }

    public ScrapeItemOutcome applyNewAnime(NewAnimeMatch match) {
        AnimeDraft draft = match.anime();
        String name = draft == null ? null : draft.name();
        int requested = match.fileIds().size();
        if (name == null || name.isBlank()) {
            log.warn("Skipping new anime without a name ({} files)", requested);
            return ScrapeItemOutcome.failed(ScrapeItemKind.NEW_ANIME, name, null, requested, "Anime name is blank");
        }

        Anime anime;
        try {
            anime = transactionTemplate.execute(status -> animeRepository.save(draft.toAnime()));
        } catch (DataAccessResourceFailureException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            log.warn("Could not create anime '{}': {}", name, ex.getMessage());
            return ScrapeItemOutcome.failed(ScrapeItemKind.NEW_ANIME, name, null, requested, ex.getMessage());
        }
        log.info("Created anime '{}' (animeId={})", name, anime.getId());

        int sitesCreated = 0;
        int sitesAlreadyLinked = 0;
        List<String> siteErrors = new ArrayList<>();
        for (SiteRef site : draft.sites()) {
            try {
                SiteLinkResult linked = animeSiteService.linkSite(anime.getId(), site);
                if (linked.created()) {
                    sitesCreated++;
                } else {
                    sitesAlreadyLinked++;
                }
                log.trace("{} -> {} {}", name, site.siteType(), site.siteId());
            } catch (DataAccessResourceFailureException ex) {
                throw ex;
            } catch (DataAccessException | IllegalArgumentException ex) {
                log.warn("Could not link {} to anime '{}': {}", site, name, ex.getMessage());
                siteErrors.add(site + ": " + ex.getMessage());
            }
        }

        int linkedFiles;
        try {
            linkedFiles = reassignFiles(match.fileIds(), anime.getId(), name);
        } catch (DataAccessResourceFailureException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            log.warn("Anime '{}' created but its files could not be linked: {}", name, ex.getMessage());
            return new ScrapeItemOutcome(ScrapeItemKind.NEW_ANIME, name, anime.getId(), ScrapeItemStatus.FAILED,
                    sitesCreated, sitesAlreadyLinked, siteErrors, requested, 0, ex.getMessage());
        }

        return new ScrapeItemOutcome(ScrapeItemKind.NEW_ANIME, name, anime.getId(), ScrapeItemStatus.APPLIED,
                sitesCreated, sitesAlreadyLinked, siteErrors, requested, linkedFiles, null);
    }

    public ScrapeItemOutcome applyExistingAnime(ExistingAnimeMatch match) {
        Long animeId = match.animeId();
        String name = match.name();
        int requested = match.fileIds().size();

        try {
            if (animeId == null || !animeRepository.existsById(animeId)) {
                log.warn("Skipping existing anime '{}': animeId={} not found", name, animeId);
                return ScrapeItemOutcome.failed(ScrapeItemKind.EXISTING_ANIME, name, animeId, requested,
                        "Anime not found: " + animeId);
            }
            int linkedFiles = reassignFiles(match.fileIds(), animeId, name);
            return new ScrapeItemOutcome(ScrapeItemKind.EXISTING_ANIME, name, animeId, ScrapeItemStatus.APPLIED,
                    0, 0, List.of(), requested, linkedFiles, null);
        } catch (DataAccessResourceFailureException ex) {
            throw ex;
        } catch (DataAccessException ex) {
            log.warn("Could not link files to existing anime '{}' (animeId={}): {}", name, animeId, ex.getMessage());
            return ScrapeItemOutcome.failed(ScrapeItemKind.EXISTING_ANIME, name, animeId, requested, ex.getMessage());
        }
    }

    private int reassignFiles(Set<Long> fileIds, Long animeId, String name) {
        if (fileIds.isEmpty()) {
            return 0;
        }
        Integer count = transactionTemplate.execute(status -> libFileRepository.reassignAnime(fileIds, animeId));
        int updated = count == null ? 0 : count;
        if (updated < fileIds.size()) {
            log.info("'{}' linked to {} of {} files (others removed or already linked)", name, updated, fileIds.size());
        } else {
            log.trace("'{}' linked to {} files", name, updated);
        }
        return updated;
    }
}
