package com.gameday.leaguedata.dto;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.GameType;
import com.gameday.leaguedata.model.GoalieStatLine;
import com.gameday.leaguedata.model.PlayerStatLine;

import java.util.List;

/**
 * Leaderboards of one division. Unfilled slots hold the empty stat line, whose name
 * fields are null; renderers must check {@code empty} before printing names.
 */
public record StatLeadersBoardDTO(Division division,
                                  Conference conference,
                                  GameType gameType,
                                  int week,
                                  int playerCount,
                                  int goalieCount,
                                  int minGamesForGaa,
                                  List<PlayerStatLine> topPoints,
                                  List<PlayerStatLine> topGoals,
                                  List<PlayerStatLine> topPointsPerGame,
                                  List<GoalieStatLine> topGoalsAgainstAverage) {
}
