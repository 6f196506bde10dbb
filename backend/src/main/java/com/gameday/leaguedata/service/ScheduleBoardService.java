package com.gameday.leaguedata.service;

import com.gameday.leaguedata.config.BoardSettings;
import com.gameday.leaguedata.dto.ScheduleBoardDTO;
import com.gameday.leaguedata.dto.ScheduleBoardDTO.DocType;
import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.util.ChunkPartitioner;
import com.gameday.leaguedata.util.ChunkPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ScheduleBoardService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleBoardService.class);

    private final BoardSettings settings;

    public ScheduleBoardService(BoardSettings settings) {
        this.settings = settings;
    }

    /**
     * One board per conference, date and game type for the current and next week.
     * A non-blank {@code divisionAbbreviation} keeps only games where either team plays in
     * that division.
     */
    public List<ScheduleBoardDTO> buildBoards(LeagueSnapshot snapshot, String divisionAbbreviation) {
        int week = snapshot.week();
        String abb = divisionAbbreviation == null ? "" : divisionAbbreviation.trim();

        List<ScheduleBoardDTO> boards = new ArrayList<>();
        for (Conference conference : snapshot.conferenceList()) {
            List<Game> games = snapshot.games().stream()
                    .filter(g -> g.inWindow(week))
                    .filter(g -> conference.name().equals(g.conference()))
                    .filter(g -> abb.isEmpty()
                            || abb.equalsIgnoreCase(g.division1().abbreviation())
                            || abb.equalsIgnoreCase(g.division2().abbreviation()))
                    .toList();
            if (games.isEmpty()) continue;

            for (List<Game> group : groupByDateAndType(games)) {
                Game first = group.get(0);
                List<List<Game>> chunks = ChunkPartitioner.chunk(group, settings.getScheduleMaxPerChunk(),
                        ChunkPolicy.HEAD_HEAVY_HALVES);
                boards.add(new ScheduleBoardDTO(conference, first.date(), first.dateShort(), first.gameTypeLabel(),
                        first.season(), docTypeOf(group, week), week, chunks));
            }
        }
        log.info("[Schedule] Built {} boards (week {}, division '{}')", boards.size(), week, abb);
        return boards;
    }

    /** Groups by date, then by game-type label, both in first-seen order. */
    static List<List<Game>> groupByDateAndType(List<Game> games) {
        Map<String, Map<String, List<Game>>> byDate = new LinkedHashMap<>();
        for (Game g : games) {
            byDate.computeIfAbsent(g.date(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(g.gameTypeLabel(), k -> new ArrayList<>())
                    .add(g);
        }
        List<List<Game>> groups = new ArrayList<>();
        byDate.values().forEach(byType -> groups.addAll(byType.values()));
        return groups;
    }

    static DocType docTypeOf(List<Game> group, int week) {
        boolean scored = group.stream().anyMatch(g -> g.week() == week && g.hasScore());
        return scored ? DocType.FINAL_SCORES : DocType.UPCOMING;
    }
}
