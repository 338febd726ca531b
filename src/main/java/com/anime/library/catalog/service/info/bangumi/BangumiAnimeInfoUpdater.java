package com.anime.library.catalog.service.info.bangumi;

import com.anime.library.catalog.model.Anime;
import com.anime.library.catalog.model.AnimeInfoSource;
import com.anime.library.catalog.model.AnimeSite;
import com.anime.library.catalog.model.ReleaseSeason;
import com.anime.library.catalog.repository.AnimeRepository;
import com.anime.library.catalog.repository.AnimeSiteRepository;
import com.anime.library.catalog.service.info.AnimeInfoUpdater;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.bangumi", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BangumiAnimeInfoUpdater implements AnimeInfoUpdater {
    private final AnimeRepository animeRepository;
    private final AnimeSiteRepository animeSiteRepository;
    private final BangumiClient bangumiClient;
    private final TransactionTemplate transactionTemplate;

    public BangumiAnimeInfoUpdater(AnimeRepository animeRepository,
                                   AnimeSiteRepository animeSiteRepository,
                                   BangumiClient bangumiClient,
                                   PlatformTransactionManager transactionManager) {
        this.animeRepository = animeRepository;
        this.animeSiteRepository = animeSiteRepository;
        this.bangumiClient = bangumiClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public AnimeInfoSource source() {
        return AnimeInfoSource.BANGUMI;
    }

    @Override
    public int refreshRelatedAnime(String siteId) {
        List<AnimeSite> sites = animeSiteRepository.findAllBySiteIdAndSiteType(siteId, AnimeInfoSource.BANGUMI);
        if (sites.isEmpty()) {
            log.debug("No anime linked to Bangumi subject {}", siteId);
            return 0;
        }

        BangumiSubject subject = bangumiClient.fetchSubject(siteId);
        LocalDateTime now = LocalDateTime.now();
        int updated = 0;
        for (AnimeSite site : sites) {
            Boolean applied = transactionTemplate.execute(status -> applySubject(site, subject, now));
            if (Boolean.TRUE.equals(applied)) {
                updated++;
            }
        }
        return updated;
    }

    private boolean applySubject(AnimeSite site, BangumiSubject subject, LocalDateTime now) {
        Anime anime = animeRepository.findById(site.getAnimeId()).orElse(null);
        boolean applied = false;
        if (anime == null) {
            log.warn("Bangumi site {} points at missing animeId={}", site.getSiteId(), site.getAnimeId());
        } else {
            if (updateAnime(anime, subject)) {
                animeRepository.save(anime);
            }
            applied = true;
        }
        site.setLastUpdate(now);
        animeSiteRepository.save(site);
        return applied;
    }

    private boolean updateAnime(Anime anime, BangumiSubject subject) {
        boolean changed = false;

        String displayName = subject.displayName();
        if (displayName != null && !displayName.equals(anime.getName())) {
            boolean taken = animeRepository.findByName(displayName)
                    .filter(other -> !other.getId().equals(anime.getId()))
                    .isPresent();
            if (taken) {
                log.warn("Keeping name '{}' for animeId={}: '{}' is used by another anime",
                        anime.getName(), anime.getId(), displayName);
            } else {
                anime.setName(displayName);
                changed = true;
            }
        }

        if (subject.name() != null && !subject.name().equals(anime.getOriginalName())) {
            anime.setOriginalName(subject.name());
            changed = true;
        }

        if (subject.date() != null && !subject.date().equals(anime.getDate())) {
            anime.setDate(subject.date());
            anime.setReleaseYear(subject.date().getYear());
            anime.setReleaseSeason(ReleaseSeason.fromDate(subject.date()));
            changed = true;
        }

        if (subject.platform() != null && !subject.platform().equals(anime.getPlatform())) {
            anime.setPlatform(subject.platform());
            changed = true;
        }

        if (subject.nsfw() != null && subject.nsfw() != anime.isNsfw()) {
            anime.setNsfw(subject.nsfw());
            changed = true;
        }

        return changed;
    }
}
