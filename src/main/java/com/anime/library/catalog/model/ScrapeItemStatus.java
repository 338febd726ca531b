package com.anime.library.catalog.model;

public enum ScrapeItemStatus {
    APPLIED,
    FAILED
}
