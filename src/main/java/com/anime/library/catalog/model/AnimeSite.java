package com.anime.library.catalog.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(
        name = "anime_sites",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_anime_sites_site_id_type",
                        columnNames = {"siteId", "siteType"}
                )
        },
        indexes = {
                @Index(name = "idx_anime_sites_anime_id", columnList = "animeId"),
                @Index(name = "idx_anime_sites_last_update", columnList = "lastUpdate")
        }
)
@Data
@NoArgsConstructor
public class AnimeSite {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String siteId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AnimeInfoSource siteType;

    @Column(nullable = false)
    private Long animeId;

    // null until an updater has refreshed this site at least once
    private LocalDateTime lastUpdate;

    public AnimeSite(Long animeId, AnimeInfoSource siteType, String siteId) {
        this.animeId = animeId;
        this.siteType = siteType;
        this.siteId = siteId;
    }

    public boolean isStale(LocalDateTime cutoff) {
        return lastUpdate == null || !lastUpdate.isAfter(cutoff);
    }
}
