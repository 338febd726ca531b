package com.anime.library.catalog.repository;

import com.anime.library.catalog.model.AnimeInfoSource;
import com.anime.library.catalog.model.AnimeSite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnimeSiteRepository extends JpaRepository<AnimeSite, Long> {
    Optional<AnimeSite> findBySiteIdAndSiteType(String siteId, AnimeInfoSource siteType);

    List<AnimeSite> findAllBySiteIdAndSiteType(String siteId, AnimeInfoSource siteType);

    List<AnimeSite> findAllByAnimeIdIn(Collection<Long> animeIds);

    @Query("""
            SELECT DISTINCT s.animeId
            FROM AnimeSite s
            WHERE s.lastUpdate IS NULL OR s.lastUpdate <= :cutoff
            ORDER BY s.animeId
            """)
    List<Long> findAnimeIdsWithStaleSites(@Param("cutoff") LocalDateTime cutoff);
}
