package com.anime.library.catalog.model;

import java.time.LocalDate;

public enum ReleaseSeason {
    WINTER,
    SPRING,
    SUMMER,
    AUTUMN;

    public static ReleaseSeason fromDate(LocalDate date) {
        if (date == null) {
            return null;
        }
        return values()[(date.getMonthValue() - 1) / 3];
    }
}
