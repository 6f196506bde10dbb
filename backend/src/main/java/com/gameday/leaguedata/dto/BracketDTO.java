package com.gameday.leaguedata.dto;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.Game;

import java.util.List;

public record BracketDTO(Division division, Conference conference, int week, List<Round> rounds) {

    public record Round(String label, List<Game> games) {}

    public boolean isEmpty() {
        return rounds.isEmpty();
    }
}
