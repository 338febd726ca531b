package com.anime.library.catalog.service.info.bangumi;

import com.anime.library.catalog.service.info.AnimeInfoFetchException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

@Slf4j
@Component
public class BangumiClient {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    private final String baseUrl;
    private final String userAgent;
    private final long requestDelayMs;
    private final int maxAttempts;

    private long lastRequestAt = 0L;

    public BangumiClient(@Value("${app.bangumi.base-url:https://api.bgm.tv}") String baseUrl,
                         @Value("${app.bangumi.user-agent:anime-library-catalog/0.1}") String userAgent,
                         @Value("${app.bangumi.request-delay-ms:500}") long requestDelayMs,
                         @Value("${app.bangumi.max-attempts:3}") int maxAttempts) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userAgent = userAgent;
        this.requestDelayMs = requestDelayMs;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public BangumiSubject fetchSubject(String subjectId) {
        if (subjectId == null || subjectId.isBlank() || !subjectId.chars().allMatch(Character::isDigit)) {
            throw new AnimeInfoFetchException("Not a Bangumi subject id: " + subjectId);
        }
        try {
            return parseSubject(requestJson("/v0/subjects/" + subjectId));
        } catch (IOException ex) {
            throw new AnimeInfoFetchException("Bangumi subject lookup failed for id=" + subjectId, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AnimeInfoFetchException("Interrupted while fetching Bangumi subject " + subjectId, ex);
        }
    }

    BangumiSubject parseSubject(JsonNode root) {
        String id = text(root, "id");
        if (id == null) {
            throw new AnimeInfoFetchException("Bangumi subject response has no id");
        }
        JsonNode nsfw = root.path("nsfw");
        return new BangumiSubject(
                id,
                text(root, "name"),
                text(root, "name_cn"),
                parseDate(text(root, "date")),
                text(root, "platform"),
                nsfw.isBoolean() ? nsfw.booleanValue() : null
        );
    }

    private synchronized JsonNode requestJson(String path) throws IOException, InterruptedException {
        int attempts = 0;
        while (true) {
            attempts++;
            applyRateLimit();

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(20))
                    .header("Accept", "application/json")
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return objectMapper.readTree(response.body());
            }

            boolean retryable = status == 429 || status == 500 || status == 502 || status == 503 || status == 504;
            if (!retryable || attempts >= maxAttempts) {
                throw new AnimeInfoFetchException("Bangumi request failed (" + status + ") for " + path);
            }
            log.debug("Bangumi returned {} for {}, retrying (attempt {}/{})", status, path, attempts, maxAttempts);
            Thread.sleep(400L * attempts);
        }
    }

    private void applyRateLimit() throws InterruptedException {
        if (requestDelayMs <= 0) {
            return;
        }
        long elapsed = System.currentTimeMillis() - lastRequestAt;
        if (elapsed < requestDelayMs) {
            Thread.sleep(requestDelayMs - elapsed);
        }
        lastRequestAt = System.currentTimeMillis();
    }

    private LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring unparseable Bangumi date '{}'", value);
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isMissingNode()) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText(null);
        return text == null || text.isBlank() ? null : text;
    }
}
