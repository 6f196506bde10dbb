package com.gameday.leaguedata.service;

import com.gameday.leaguedata.dto.BracketDTO;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.LeagueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class BracketService {

    private static final Logger log = LoggerFactory.getLogger(BracketService.class);

    private final DivisionSelector selector;

    public BracketService(DivisionSelector selector) {
        this.selector = selector;
    }

    /**
     * Playoff bracket of one division, by abbreviation or full label. Empty when the
     * filter does not name a single division.
     */
    public Optional<BracketDTO> buildBracket(LeagueSnapshot snapshot, String division) {
        DivisionSelection selection = selector.select(division, snapshot.divisionList(), snapshot.conferenceList());
        if (selection.scope() != DivisionSelection.Scope.DIVISION) {
            log.debug("[Bracket] '{}' does not name a division", division);
            return Optional.empty();
        }
        Division d = selection.divisions().get(0);
        return Optional.of(buildBracket(snapshot, d));
    }

    BracketDTO buildBracket(LeagueSnapshot snapshot, Division division) {
        int week = snapshot.week();
        String label = division.fullName();
        Map<String, List<Game>> byRound = new LinkedHashMap<>();
        for (Game g : snapshot.games()) {
            if (g.isPlayoff() && g.inWindow(week) && label.equals(g.division1().fullName())) {
                byRound.computeIfAbsent(g.round(), k -> new ArrayList<>()).add(g);
            }
        }
        List<BracketDTO.Round> rounds = new ArrayList<>();
        byRound.forEach((round, games) -> rounds.add(new BracketDTO.Round(round, List.copyOf(games))));
        log.info("[Bracket] {}: {} rounds in week {}", division.abbreviation(), rounds.size(), week);
        return new BracketDTO(division,
                StandingsBoardService.conferenceOf(division, snapshot.conferenceList()), week, rounds);
    }
}
