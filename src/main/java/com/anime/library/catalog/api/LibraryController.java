package com.anime.library.catalog.api;

import com.anime.library.catalog.model.LibFile;
import com.anime.library.catalog.model.LibraryScrapeResult;
import com.anime.library.catalog.model.ScrapeApplyReport;
import com.anime.library.catalog.service.AnimeScrapeResultService;
import com.anime.library.catalog.service.LibraryReader;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/library")
public class LibraryController {
    private final AnimeScrapeResultService animeScrapeResultService;
    private final LibraryReader libraryReader;

    public LibraryController(AnimeScrapeResultService animeScrapeResultService, LibraryReader libraryReader) {
        this.animeScrapeResultService = animeScrapeResultService;
        this.libraryReader = libraryReader;
    }

    @PostMapping("/scrape-results")
    public ScrapeApplyReport applyScrapeResult(@RequestBody LibraryScrapeResult result) {
        return animeScrapeResultService.applyLibraryScrapeResult(result);
    }

    @GetMapping("/{libraryId}/files")
    public List<LibFile> listFiles(
            @PathVariable Long libraryId,
            @RequestParam(name = "path", defaultValue = "/") String path,
            @RequestParam(name = "unlinked", defaultValue = "false") boolean unlinked,
            @RequestParam(name = "recursive", defaultValue = "false") boolean recursive
    ) {
        if (recursive) {
            List<LibFile> files = libraryReader.getAllSubFiles(libraryId, path);
            return unlinked
                    ? files.stream().filter(file -> file.getAnimeId() == null).toList()
                    : files;
        }
        if (unlinked) {
            return libraryReader.getFirstSubFilesWithNoAnime(libraryId, path);
        }
        return libraryReader.getFirstSubFiles(libraryId, path);
    }
}
