package com.gameday.leaguedata.service;

import com.gameday.leaguedata.config.BoardSettings;
import com.gameday.leaguedata.dto.StandingsBoardDTO;
import com.gameday.leaguedata.dto.StandingsEntryDTO;
import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.model.StandingsRow;
import com.gameday.leaguedata.model.Team;
import com.gameday.leaguedata.util.ChunkPartitioner;
import com.gameday.leaguedata.util.ChunkPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class StandingsBoardService {

    private static final Logger log = LoggerFactory.getLogger(StandingsBoardService.class);

    /** Rank used for rows whose RANK cell is blank, so they sort last. */
    static final int UNRANKED = 999;

    private final DivisionSelector selector;
    private final BoardSettings settings;

    public StandingsBoardService(DivisionSelector selector, BoardSettings settings) {
        this.selector = selector;
        this.settings = settings;
    }

    public List<StandingsBoardDTO> buildBoards(LeagueSnapshot snapshot, String divisionFilter, boolean includeIdle) {
        DivisionSelection selection = selector.select(divisionFilter, snapshot.divisionList(), snapshot.conferenceList());
        List<Division> active = selector.activeDivisions(selection, snapshot.games(), snapshot.week(), includeIdle);

        Map<String, Team> teamsByFullName = new HashMap<>();
        for (Team t : snapshot.teamList()) teamsByFullName.putIfAbsent(t.fullName(), t);

        List<StandingsBoardDTO> boards = new ArrayList<>();
        for (Division d : active) {
            List<StandingsRow> divRows = snapshot.standingsRows().stream()
                    .filter(r -> d.fullName().equals(r.division()))
                    .toList();
            if (divRows.isEmpty()) {
                log.debug("[Standings] No standings rows for {}", d.abbreviation());
                continue;
            }
            boards.add(buildBoard(d, conferenceOf(d, snapshot.conferenceList()), divRows,
                    teamsByFullName, snapshot.games(), snapshot.week()));
        }
        log.info("[Standings] Built {} boards for filter '{}'", boards.size(), selection.filter());
        return boards;
    }

    StandingsBoardDTO buildBoard(Division division, Conference conference, List<StandingsRow> divRows,
                                 Map<String, Team> teamsByFullName, List<Game> games, int week) {
        List<StandingsRow> ordered = sortByRank(divRows);
        List<List<StandingsRow>> pages = ChunkPartitioner.chunk(ordered, settings.getStandingsMaxPerChunk(), ChunkPolicy.BALANCED);

        List<List<StandingsEntryDTO>> chunks = new ArrayList<>();
        int placed = 0;
        for (List<StandingsRow> page : pages) {
            List<StandingsEntryDTO> entries = new ArrayList<>(page.size());
            for (StandingsRow row : page) {
                placed++;
                entries.add(new StandingsEntryDTO(placed, row, teamsByFullName.get(row.teamFullName())));
            }
            chunks.add(entries);
        }
        return new StandingsBoardDTO(division, conference, week, ordered.size(), chunks,
                hasPlayoffGames(division, games, week));
    }

    /** Ascending RANK; blank ranks last. The sort is stable, so sheet order breaks ties. */
    public static List<StandingsRow> sortByRank(List<StandingsRow> rows) {
        List<StandingsRow> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparingInt(r -> r.rank() == null ? UNRANKED : r.rank()));
        return sorted;
    }

    static boolean hasPlayoffGames(Division division, List<Game> games, int week) {
        String label = division.fullName();
        return games.stream().anyMatch(g -> g.isPlayoff() && g.inWindow(week) && label.equals(g.division1().fullName()));
    }

    static Conference conferenceOf(Division division, List<Conference> conferences) {
        for (Conference c : conferences) {
            if (c.name().equals(division.conference())) return c;
        }
        return null;
    }
}
