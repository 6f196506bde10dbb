package com.gameday.leaguedata.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Template limits for the boards handed to the renderer. */
@Component
public class BoardSettings {

    @Value("${gameday.boards.standings-max-per-chunk:9}")
    private int standingsMaxPerChunk;

    @Value("${gameday.boards.schedule-max-per-chunk:10}")
    private int scheduleMaxPerChunk;

    @Value("${gameday.boards.min-players:5}")
    private int minPlayers;

    @Value("${gameday.boards.top-points:5}")
    private int topPoints;

    @Value("${gameday.boards.top-goals:3}")
    private int topGoals;

    @Value("${gameday.boards.top-ppg:3}")
    private int topPointsPerGame;

    @Value("${gameday.boards.top-gaa:3}")
    private int topGoalsAgainstAverage;

    public BoardSettings() {}

    public BoardSettings(int standingsMaxPerChunk, int scheduleMaxPerChunk, int minPlayers,
                         int topPoints, int topGoals, int topPointsPerGame, int topGoalsAgainstAverage) {
        this.standingsMaxPerChunk = standingsMaxPerChunk;
        this.scheduleMaxPerChunk = scheduleMaxPerChunk;
        this.minPlayers = minPlayers;
        this.topPoints = topPoints;
        this.topGoals = topGoals;
        this.topPointsPerGame = topPointsPerGame;
        this.topGoalsAgainstAverage = topGoalsAgainstAverage;
    }

    public static BoardSettings defaults() {
        return new BoardSettings(9, 10, 5, 5, 3, 3, 3);
    }

    public int getStandingsMaxPerChunk() { return standingsMaxPerChunk; }

    public int getScheduleMaxPerChunk() { return scheduleMaxPerChunk; }

    public int getMinPlayers() { return minPlayers; }

    public int getTopPoints() { return topPoints; }

    public int getTopGoals() { return topGoals; }

    public int getTopPointsPerGame() { return topPointsPerGame; }

    public int getTopGoalsAgainstAverage() { return topGoalsAgainstAverage; }
}
