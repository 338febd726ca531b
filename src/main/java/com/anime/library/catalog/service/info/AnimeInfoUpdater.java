package com.anime.library.catalog.service.info;

import com.anime.library.catalog.model.AnimeInfoSource;

/**
 * Refreshes catalog info from one external site.
 */
public interface AnimeInfoUpdater {

    AnimeInfoSource source();

    /**
     * Fetches the site's current record for {@code siteId} and writes it to every anime linked
     * to that id, stamping each link's {@code lastUpdate}. Safe to call repeatedly.
     *
     * @return number of anime updated
     * @throws AnimeInfoFetchException when the site cannot be reached or its answer is unusable
     */
    int refreshRelatedAnime(String siteId);
}
