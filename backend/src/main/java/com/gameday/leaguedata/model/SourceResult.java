package com.gameday.leaguedata.model;

import java.util.List;

/**
 * Data loaded from one sheet together with how the load went. An UNAVAILABLE result
 * carries the fallback data (usually empty) and the reason.
 */
public record SourceResult<T>(T data, SourceStatus status, String message) {

    public static <E> SourceResult<List<E>> ofList(List<E> items) {
        List<E> copy = List.copyOf(items);
        return new SourceResult<>(copy, copy.isEmpty() ? SourceStatus.EMPTY : SourceStatus.OK, null);
    }

    public static SourceResult<ScheduleSheet> ofSchedule(ScheduleSheet sheet) {
        return new SourceResult<>(sheet, sheet.games().isEmpty() ? SourceStatus.EMPTY : SourceStatus.OK, null);
    }

    public static <T> SourceResult<T> unavailable(T fallback, String message) {
        return new SourceResult<>(fallback, SourceStatus.UNAVAILABLE, message);
    }

    public boolean isAvailable() {
        return status != SourceStatus.UNAVAILABLE;
    }
}
