package com.gameday.leaguedata.dto;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;

import java.util.List;

/**
 * Standings of one division, split into template pages. {@code bracketTriggered} is set
 * when the division has playoff games this week or next.
 */
public record StandingsBoardDTO(Division division,
                                Conference conference,
                                int week,
                                int teamCount,
                                List<List<StandingsEntryDTO>> chunks,
                                boolean bracketTriggered) {
}
