package com.anime.library.catalog.model;

public record SiteLinkResult(AnimeSite site, boolean created) {
}
