package com.gameday.leaguedata.exception;

/**
 * The master registry has no usable row for a league. A missing row and a partially
 * filled row are reported the same way.
 */
public class LeagueConfigurationException extends RuntimeException {

    private final String leagueName;

    public LeagueConfigurationException(String leagueName, String message) {
        super(message);
        this.leagueName = leagueName;
    }

    public LeagueConfigurationException(String leagueName, String message, Throwable cause) {
        super(message, cause);
        this.leagueName = leagueName;
    }

    public String getLeagueName() {
        return leagueName;
    }
}
