package com.anime.library.catalog.service.info;

public class AnimeInfoFetchException extends RuntimeException {
    public AnimeInfoFetchException(String message) {
        super(message);
    }

    public AnimeInfoFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
