package com.gameday.leaguedata.model;

/** Sheet locations resolved from the master registry for one league. */
public record LeagueResources(String leagueName,
                              String divisionUrl,
                              String teamUrl,
                              String scheduleUrl,
                              String standingsUrl,
                              String goalieUrl,
                              String playerUrl) {

    public String locationOf(LeagueSource source) {
        return switch (source) {
            case DIVISIONS -> divisionUrl;
            case TEAMS -> teamUrl;
            case SCHEDULE -> scheduleUrl;
            case STANDINGS -> standingsUrl;
            case GOALIE_STATS -> goalieUrl;
            case PLAYER_STATS -> playerUrl;
        };
    }
}
