package com.gameday.leaguedata.model;

public record PlayerStatLine(String firstName,
                             String lastName,
                             String fullName,
                             String team,
                             String division,
                             int goals,
                             int assists,
                             int points,
                             double pointsPerGame) {

    /** Placeholder for unfilled leaderboard slots. Name fields are null. */
    public static final PlayerStatLine EMPTY = new PlayerStatLine(null, null, null, null, null, 0, 0, 0, 0.0);

    public boolean isEmpty() {
        return fullName == null;
    }
}
