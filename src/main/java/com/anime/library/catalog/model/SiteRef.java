package com.anime.library.catalog.model;

public record SiteRef(AnimeInfoSource siteType, String siteId) {
}
