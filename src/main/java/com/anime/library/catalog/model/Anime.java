package com.anime.library.catalog.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "anime")
@Data
@NoArgsConstructor
public class Anime {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String name;

    private String originalName;

    private boolean bdrip;
    private boolean nsfw;

    private String platform;
    @Column(name = "release_date")
    private LocalDate date;
    private Integer releaseYear;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ReleaseSeason releaseSeason;

    private String region;

    private LocalDateTime createdAt = LocalDateTime.now();

    public Anime(String name) {
        this.name = name;
    }
}
