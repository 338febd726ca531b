package com.anime.library.catalog.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.anime.library.catalog.model.ExistingAnimeMatch;
import com.anime.library.catalog.model.LibraryScrapeResult;
import com.anime.library.catalog.service.AnimeScrapeResultService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class ScrapeResultJsonImporterTest {

    @TempDir
    Path tempDir;

    private AnimeScrapeResultService animeScrapeResultService;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        animeScrapeResultService = mock(AnimeScrapeResultService.class);
        objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    @Test
    void appliesScrapeResultFile() throws Exception {
        Path file = tempDir.resolve("scrape-result.json");
        Files.writeString(file, """
                {
                  "newAnime": [{
                    "anime": {"name": "Show A", "date": "2024-01-07", "sites": []},
                    "fileIds": [1]
                  }],
                  "existingAnime": [{"animeId": 4, "name": "Show B", "fileIds": [2, 3]}]
                }
                """, StandardCharsets.UTF_8);

        new ScrapeResultJsonImporter(animeScrapeResultService, objectMapper, file.toString()).run();

        ArgumentCaptor<LibraryScrapeResult> captor = ArgumentCaptor.forClass(LibraryScrapeResult.class);
        verify(animeScrapeResultService).applyLibraryScrapeResult(captor.capture());
        assertEquals("Show A", captor.getValue().newAnime().get(0).anime().name());
        ExistingAnimeMatch existing = captor.getValue().existingAnime().get(0);
        assertEquals(4L, existing.animeId());
        assertEquals(Set.of(2L, 3L), existing.fileIds());
    }

    @Test
    void missingFileIsSkipped() throws Exception {
        Path missing = tempDir.resolve("nope.json");

        new ScrapeResultJsonImporter(animeScrapeResultService, objectMapper, missing.toString()).run();

        verify(animeScrapeResultService, never()).applyLibraryScrapeResult(any());
    }
}
