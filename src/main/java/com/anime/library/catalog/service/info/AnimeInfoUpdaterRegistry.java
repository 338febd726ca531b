package com.anime.library.catalog.service.info;

import com.anime.library.catalog.model.AnimeInfoSource;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class AnimeInfoUpdaterRegistry {
    private final Map<AnimeInfoSource, AnimeInfoUpdater> updatersBySource;

    public AnimeInfoUpdaterRegistry(List<AnimeInfoUpdater> updaters) {
        Map<AnimeInfoSource, AnimeInfoUpdater> bySource = new EnumMap<>(AnimeInfoSource.class);
        for (AnimeInfoUpdater updater : updaters) {
            AnimeInfoUpdater previous = bySource.put(updater.source(), updater);
            if (previous != null) {
                throw new IllegalStateException("Two info updaters registered for " + updater.source()
                        + ": " + previous.getClass().getSimpleName() + ", " + updater.getClass().getSimpleName());
            }
        }
        this.updatersBySource = Collections.unmodifiableMap(bySource);
    }

    /**
     * @return the updater for {@code source}, or empty when that site is not supported
     */
    public Optional<AnimeInfoUpdater> find(AnimeInfoSource source) {
        if (source == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(updatersBySource.get(source));
    }
}
