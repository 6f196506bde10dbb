package com.gameday.leaguedata.service;

import com.gameday.leaguedata.config.BoardSettings;
import com.gameday.leaguedata.dto.StatLeadersBoardDTO;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.GameType;
import com.gameday.leaguedata.model.GoalieStatLine;
import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.model.PlayerStatLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Stat-leader boards per division. A division gets a board for each game type it plays
 * this week or next (every division and both types when idle divisions are included).
 * The stat sheets carry season totals, so both boards of a division rank the same pool.
 */
@Service
public class StatLeadersService {

    private static final Logger log = LoggerFactory.getLogger(StatLeadersService.class);

    private final DivisionSelector selector;
    private final LeaderboardSelector leaderboards;
    private final BoardSettings settings;

    public StatLeadersService(DivisionSelector selector, LeaderboardSelector leaderboards, BoardSettings settings) {
        this.selector = selector;
        this.leaderboards = leaderboards;
        this.settings = settings;
    }

    public List<StatLeadersBoardDTO> buildBoards(LeagueSnapshot snapshot, String divisionFilter, boolean includeIdle) {
        DivisionSelection selection = selector.select(divisionFilter, snapshot.divisionList(), snapshot.conferenceList());
        List<StatLeadersBoardDTO> boards = new ArrayList<>();

        for (GameType type : GameType.values()) {
            List<Division> active = selector.activeDivisions(selection, snapshot.games(), snapshot.week(), includeIdle, type);
            for (Division d : active) {
                StatLeadersBoardDTO board = buildBoard(snapshot, d, type);
                if (board != null) boards.add(board);
            }
        }
        log.info("[StatLeaders] Built {} boards for filter '{}'", boards.size(), selection.filter());
        return boards;
    }

    /** Null when the division has fewer players than a board needs. */
    StatLeadersBoardDTO buildBoard(LeagueSnapshot snapshot, Division division, GameType type) {
        String label = division.fullName();
        List<PlayerStatLine> players = snapshot.players().stream()
                .filter(p -> label.equals(p.division()))
                .toList();
        if (players.size() < settings.getMinPlayers()) {
            log.debug("[StatLeaders] Skipping {}: {} players", division.abbreviation(), players.size());
            return null;
        }
        List<GoalieStatLine> goalies = snapshot.goalies().stream()
                .filter(g -> label.equals(g.division()))
                .toList();

        return new StatLeadersBoardDTO(
                division,
                StandingsBoardService.conferenceOf(division, snapshot.conferenceList()),
                type,
                snapshot.week(),
                players.size(),
                goalies.size(),
                LeaderboardSelector.minGamesForGaa(goalies),
                leaderboards.topPoints(players, settings.getTopPoints()),
                leaderboards.topGoals(players, settings.getTopGoals()),
                leaderboards.topPointsPerGame(players, settings.getTopPointsPerGame()),
                leaderboards.topGoalsAgainstAverage(goalies, settings.getTopGoalsAgainstAverage())
        );
    }
}
