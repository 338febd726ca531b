package com.anime.library.catalog.service;

import com.anime.library.catalog.model.LibFile;
import com.anime.library.catalog.repository.LibFileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookups of scanned files inside one library. Paths are absolute POSIX paths;
 * removed files are never returned.
 */
@Service
@RequiredArgsConstructor
public class LibraryReader {
    private static final String ROOT = "/";

    private final LibFileRepository libFileRepository;

    public Optional<LibFile> getFile(Long libraryId, String path) {
        String normalized = normalize(path);
        if (ROOT.equals(normalized)) {
            return Optional.empty();
        }
        int slash = normalized.lastIndexOf('/');
        String dir = slash == 0 ? ROOT : normalized.substring(0, slash);
        String base = normalized.substring(slash + 1);
        return libFileRepository.findByLibraryIdAndPathAndNameAndRemovedFalse(libraryId, dir, base);
    }

    /**
     * Files and directories directly inside {@code dir}.
     */
    public List<LibFile> getFirstSubFiles(Long libraryId, String dir) {
        return libFileRepository.findAllByLibraryIdAndPathAndRemovedFalse(libraryId, normalize(dir));
    }

    /**
     * Like {@link #getFirstSubFiles} but only entries not yet linked to an anime.
     */
    public List<LibFile> getFirstSubFilesWithNoAnime(Long libraryId, String dir) {
        return libFileRepository.findAllByLibraryIdAndPathAndAnimeIdIsNullAndRemovedFalse(libraryId, normalize(dir));
    }

    public List<LibFile> getAllSubFiles(Long libraryId, String dir) {
        String normalized = normalize(dir);
        if (ROOT.equals(normalized)) {
            return libFileRepository.findAllByLibraryIdAndPathStartingWithAndRemovedFalse(libraryId, ROOT);
        }
        String childPrefix = normalized + "/";
        return libFileRepository.findAllByLibraryIdAndPathStartingWithAndRemovedFalse(libraryId, normalized).stream()
                .filter(file -> file.getPath().equals(normalized) || file.getPath().startsWith(childPrefix))
                .toList();
    }

    static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Library path is required");
        }
        String normalized = path.trim().replaceAll("/+", "/");
        if (!normalized.startsWith("/")) {
            throw new IllegalArgumentException("Library path must be absolute: " + path);
        }
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
