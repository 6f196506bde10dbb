package com.gameday.leaguedata.model;

public record GoalieStatLine(String firstName,
                             String lastName,
                             String fullName,
                             String team,
                             String division,
                             int goalsAgainst,
                             double goalsAgainstAverage,
                             int gamesPlayed) {

    /** Placeholder for unfilled leaderboard slots. Name fields are null. */
    public static final GoalieStatLine EMPTY = new GoalieStatLine(null, null, null, null, null, 0, 0.0, 0);

    public boolean isEmpty() {
        return fullName == null;
    }
}
