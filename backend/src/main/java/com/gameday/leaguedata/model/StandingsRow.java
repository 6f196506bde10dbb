package com.gameday.leaguedata.model;

/**
 * One row of the standings sheet. Team identity is not owned here; city and name are
 * looked up through {@link Team#fullName()} when needed.
 */
public record StandingsRow(String teamFullName,
                           String division,
                           int gamesPlayed,
                           int wins,
                           int overtimeWins,
                           int overtimeLosses,
                           int losses,
                           int points,
                           int goalDifferential,
                           double winPercentage,
                           int goalsFor,
                           int goalsAgainst,
                           Integer rank) {
}
