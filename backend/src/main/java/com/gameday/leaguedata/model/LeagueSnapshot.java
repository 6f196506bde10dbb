package com.gameday.leaguedata.model;

import java.util.List;

/** Everything loaded for one league in one run. */
public record LeagueSnapshot(String leagueName,
                             SourceResult<List<Division>> divisions,
                             SourceResult<List<Conference>> conferences,
                             SourceResult<List<Team>> teams,
                             SourceResult<List<StandingsRow>> standings,
                             SourceResult<ScheduleSheet> schedule,
                             SourceResult<List<PlayerStatLine>> playerStats,
                             SourceResult<List<GoalieStatLine>> goalieStats) {

    public List<Division> divisionList() { return divisions.data(); }

    public List<Conference> conferenceList() { return conferences.data(); }

    public List<Team> teamList() { return teams.data(); }

    public List<StandingsRow> standingsRows() { return standings.data(); }

    public List<Game> games() { return schedule.data().games(); }

    public int week() { return schedule.data().week(); }

    public int year() { return schedule.data().year(); }

    public List<PlayerStatLine> players() { return playerStats.data(); }

    public List<GoalieStatLine> goalies() { return goalieStats.data(); }
}
