package com.anime.library.catalog.repository;

import com.anime.library.catalog.model.LibFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LibFileRepository extends JpaRepository<LibFile, Long> {
    Optional<LibFile> findByLibraryIdAndPathAndNameAndRemovedFalse(Long libraryId, String path, String name);

    List<LibFile> findAllByLibraryIdAndPathAndRemovedFalse(Long libraryId, String path);

    List<LibFile> findAllByLibraryIdAndPathAndAnimeIdIsNullAndRemovedFalse(Long libraryId, String path);

    List<LibFile> findAllByLibraryIdAndPathStartingWithAndRemovedFalse(Long libraryId, String pathPrefix);

    // Rows already pointing at the target are left alone, so a repeated call reports 0.
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE LibFile f
               SET f.animeId = :animeId
             WHERE f.id IN :fileIds
               AND f.removed = false
               AND (f.animeId IS NULL OR f.animeId <> :animeId)
            """)
    int reassignAnime(@Param("fileIds") Collection<Long> fileIds, @Param("animeId") Long animeId);
}
