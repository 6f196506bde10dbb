package com.gameday.leaguedata.model;

/**
 * The six per-league sheets listed in the master registry, with the registry column that
 * holds each location and the row carrying the sheet's header.
 */
public enum LeagueSource {
    DIVISIONS("DIVISION INFO", 0),
    TEAMS("TEAM INFO", 0),
    SCHEDULE("SCHEDULE", 2),
    STANDINGS("STANDINGS", 0),
    GOALIE_STATS("GOALIE STATS", 0),
    PLAYER_STATS("PLAYER STATS", 0);

    private final String registryColumn;
    private final int headerRow;

    LeagueSource(String registryColumn, int headerRow) {
        this.registryColumn = registryColumn;
        this.headerRow = headerRow;
    }

    public String registryColumn() {
        return registryColumn;
    }

    public int headerRow() {
        return headerRow;
    }
}
