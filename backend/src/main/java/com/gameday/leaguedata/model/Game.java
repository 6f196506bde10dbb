package com.gameday.leaguedata.model;

public record Game(int week,
                   GameType gameType,
                   String gameTypeLabel,
                   String season,
                   String date,
                   String dateShort,
                   String day,
                   String time,
                   String team1,
                   DivisionRef division1,
                   String score1,
                   String team2,
                   DivisionRef division2,
                   String score2,
                   String status,
                   String location,
                   String seed1,
                   String seed2,
                   String round) {

    public boolean isPlayoff() {
        return gameType == GameType.PLAYOFF;
    }

    /** Conference of the first team's division; empty when that division did not resolve. */
    public String conference() {
        return division1.conference();
    }

    public boolean hasScore() {
        return score1 != null && !score1.isBlank();
    }

    /** Current week or the one after it. */
    public boolean inWindow(int currentWeek) {
        return week == currentWeek || week == currentWeek + 1;
    }
}
