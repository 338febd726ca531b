package com.anime.library.catalog.importer;

import com.anime.library.catalog.model.LibraryScrapeResult;
import com.anime.library.catalog.model.ScrapeApplyReport;
import com.anime.library.catalog.service.AnimeScrapeResultService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Applies a scrape result that the library scraper wrote to disk as JSON.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.scrape-result.import.enabled", havingValue = "true")
public class ScrapeResultJsonImporter implements CommandLineRunner {
    private final AnimeScrapeResultService animeScrapeResultService;
    private final ObjectMapper objectMapper;
    private final String importPath;

    public ScrapeResultJsonImporter(AnimeScrapeResultService animeScrapeResultService,
                                    ObjectMapper objectMapper,
                                    @Value("${app.scrape-result.import.path:scrape-result.json}") String importPath) {
        this.animeScrapeResultService = animeScrapeResultService;
        this.objectMapper = objectMapper;
        this.importPath = importPath;
    }

    @Override
    public void run(String... args) throws Exception {
        Path path = Path.of(importPath);
        if (!Files.exists(path)) {
            log.info("Scrape result import skipped. File not found: {}", path.toAbsolutePath());
            return;
        }
        importFile(path);
    }

    public ScrapeApplyReport importFile(Path path) throws IOException {
        log.info("Applying scrape result from: {}", path.toAbsolutePath());
        LibraryScrapeResult result;
        try (InputStream input = Files.newInputStream(path)) {
            result = objectMapper.readValue(input, LibraryScrapeResult.class);
        }
        return animeScrapeResultService.applyLibraryScrapeResult(result);
    }
}
