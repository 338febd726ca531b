package com.anime.library.catalog.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "lib_files",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_lib_files_library_path_name",
                        columnNames = {"libraryId", "path", "name"}
                )
        },
        indexes = {
                @Index(name = "idx_lib_files_anime_id", columnList = "animeId"),
                @Index(name = "idx_lib_files_library_path", columnList = "libraryId, path")
        }
)
@Data
@NoArgsConstructor
public class LibFile {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long libraryId;

    @Column(nullable = false)
    private String path;

    @Column(nullable = false)
    private String name;

    private boolean directory;

    private Long animeId;

    private boolean removed = false;

    public LibFile(Long libraryId, String path, String name) {
        this.libraryId = libraryId;
        this.path = path;
        this.name = name;
    }
}
