package com.gameday.leaguedata.model;

public enum GameType {
    REGULAR_SEASON,
    PLAYOFF;

    private static final String PLAYOFF_LABEL = "Playoffs";

    /** Sheet label "Playoffs" marks playoff games; every other label is regular season. */
    public static GameType fromLabel(String label) {
        if (label != null && PLAYOFF_LABEL.equalsIgnoreCase(label.trim())) return PLAYOFF;
        return REGULAR_SEASON;
    }
}
