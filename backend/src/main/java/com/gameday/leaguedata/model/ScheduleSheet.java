package com.gameday.leaguedata.model;

import java.util.List;

/** Games of the schedule sheet plus the week and year the sheet is published for. */
public record ScheduleSheet(List<Game> games, int week, int year) {

    public static final ScheduleSheet EMPTY = new ScheduleSheet(List.of(), 0, 0);
}
