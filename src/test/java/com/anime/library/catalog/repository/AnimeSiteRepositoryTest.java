package com.anime.library.catalog.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.anime.library.catalog.model.Anime;
import com.anime.library.catalog.model.AnimeInfoSource;
import com.anime.library.catalog.model.AnimeSite;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

@DataJpaTest
class AnimeSiteRepositoryTest {

    private static final LocalDateTime CUTOFF = LocalDateTime.of(2024, 5, 1, 0, 0);

    @Autowired
    private AnimeSiteRepository animeSiteRepository;

    @Autowired
    private AnimeRepository animeRepository;

    @Test
    void staleQueryFindsAnimeWithAnyOldOrNeverUpdatedSite() {
        Long neverUpdated = animeRepository.save(new Anime("Never")).getId();
        Long mixed = animeRepository.save(new Anime("Mixed")).getId();
        Long fresh = animeRepository.save(new Anime("Fresh")).getId();

        animeSiteRepository.save(new AnimeSite(neverUpdated, AnimeInfoSource.BANGUMI, "1"));
        animeSiteRepository.save(site(mixed, AnimeInfoSource.BANGUMI, "2", CUTOFF.minusDays(1)));
        animeSiteRepository.save(site(mixed, AnimeInfoSource.ANILIST, "2", CUTOFF.plusDays(1)));
        animeSiteRepository.save(site(fresh, AnimeInfoSource.BANGUMI, "3", CUTOFF.plusSeconds(1)));

        List<Long> stale = animeSiteRepository.findAnimeIdsWithStaleSites(CUTOFF);

        assertEquals(List.of(neverUpdated, mixed), stale);
        assertEquals(3, animeSiteRepository.findAllByAnimeIdIn(stale).size());
    }

    @Test
    void siteNaturalKeyIsUnique() {
        Long first = animeRepository.save(new Anime("First")).getId();
        Long second = animeRepository.save(new Anime("Second")).getId();
        animeSiteRepository.saveAndFlush(new AnimeSite(first, AnimeInfoSource.BANGUMI, "100"));

        assertThrows(DataIntegrityViolationException.class,
                () -> animeSiteRepository.saveAndFlush(new AnimeSite(second, AnimeInfoSource.BANGUMI, "100")));
    }

    @Test
    void sameIdOnDifferentSitesIsAllowed() {
        Long animeId = animeRepository.save(new Anime("Shared Id")).getId();
        animeSiteRepository.saveAndFlush(new AnimeSite(animeId, AnimeInfoSource.BANGUMI, "5"));
        animeSiteRepository.saveAndFlush(new AnimeSite(animeId, AnimeInfoSource.MYANIMELIST, "5"));

        assertEquals(1, animeSiteRepository.findAllBySiteIdAndSiteType("5", AnimeInfoSource.BANGUMI).size());
        assertEquals(2, animeSiteRepository.findAllByAnimeIdIn(List.of(animeId)).size());
    }

    private AnimeSite site(Long animeId, AnimeInfoSource type, String siteId, LocalDateTime lastUpdate) {
        AnimeSite site = new AnimeSite(animeId, type, siteId);
        site.setLastUpdate(lastUpdate);
        return site;
    }
}
