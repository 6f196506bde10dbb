package com.gameday.leaguedata.controller;

import com.gameday.leaguedata.config.BoardSettings;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/config")
@CrossOrigin(origins = "*")
public class ConfigController {
    private final BoardSettings boardSettings;

    public ConfigController(BoardSettings boardSettings) {
        this.boardSettings = boardSettings;
    }

    @GetMapping("/boards")
    public Map<String, Object> getBoardSettings() {
        return Map.of(
                "standingsMaxPerChunk", boardSettings.getStandingsMaxPerChunk(),
                "scheduleMaxPerChunk", boardSettings.getScheduleMaxPerChunk(),
                "minPlayers", boardSettings.getMinPlayers(),
                "topPoints", boardSettings.getTopPoints(),
                "topGoals", boardSettings.getTopGoals(),
                "topPointsPerGame", boardSettings.getTopPointsPerGame(),
                "topGoalsAgainstAverage", boardSettings.getTopGoalsAgainstAverage()
        );
    }
}
