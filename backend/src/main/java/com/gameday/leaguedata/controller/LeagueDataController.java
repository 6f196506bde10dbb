package com.gameday.leaguedata.controller;

import com.gameday.leaguedata.dto.BracketDTO;
import com.gameday.leaguedata.dto.ScheduleBoardDTO;
import com.gameday.leaguedata.dto.StandingsBoardDTO;
import com.gameday.leaguedata.dto.StatLeadersBoardDTO;
import com.gameday.leaguedata.exception.LeagueConfigurationException;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.LeagueResources;
import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.service.BracketService;
import com.gameday.leaguedata.service.DivisionSelector;
import com.gameday.leaguedata.service.LeagueRunService;
import com.gameday.leaguedata.service.ScheduleBoardService;
import com.gameday.leaguedata.service.StandingsBoardService;
import com.gameday.leaguedata.service.StatLeadersService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/leagues/{league}")
@CrossOrigin(origins = "*")
public class LeagueDataController {

    private final LeagueRunService runService;
    private final DivisionSelector divisionSelector;
    private final StandingsBoardService standingsBoardService;
    private final StatLeadersService statLeadersService;
    private final ScheduleBoardService scheduleBoardService;
    private final BracketService bracketService;

    public LeagueDataController(LeagueRunService runService,
                                DivisionSelector divisionSelector,
                                StandingsBoardService standingsBoardService,
                                StatLeadersService statLeadersService,
                                ScheduleBoardService scheduleBoardService,
                                BracketService bracketService) {
        this.runService = runService;
        this.divisionSelector = divisionSelector;
        this.standingsBoardService = standingsBoardService;
        this.statLeadersService = statLeadersService;
        this.scheduleBoardService = scheduleBoardService;
        this.bracketService = bracketService;
    }

    @GetMapping("/resources")
    public LeagueResources resources(@PathVariable String league,
                                     @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        try {
            return runService.resources(league, fresh);
        } catch (LeagueConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }

    @GetMapping("/snapshot")
    public LeagueSnapshot snapshot(@PathVariable String league,
                                   @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        return runService.snapshot(league, fresh);
    }

    @GetMapping("/standings")
    public List<StandingsBoardDTO> standings(@PathVariable String league,
                                             @RequestParam(value = "division", required = false) String division,
                                             @RequestParam(value = "all", defaultValue = "false") boolean all,
                                             @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        LeagueSnapshot snapshot = runService.snapshot(league, fresh);
        requireKnownFilter(snapshot, division);
        return standingsBoardService.buildBoards(snapshot, division, all);
    }

    @GetMapping("/stat-leaders")
    public List<StatLeadersBoardDTO> statLeaders(@PathVariable String league,
                                                 @RequestParam(value = "division", required = false) String division,
                                                 @RequestParam(value = "all", defaultValue = "false") boolean all,
                                                 @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        LeagueSnapshot snapshot = runService.snapshot(league, fresh);
        requireKnownFilter(snapshot, division);
        return statLeadersService.buildBoards(snapshot, division, all);
    }

    @GetMapping("/schedule")
    public List<ScheduleBoardDTO> schedule(@PathVariable String league,
                                           @RequestParam(value = "division", required = false) String division,
                                           @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        return scheduleBoardService.buildBoards(runService.snapshot(league, fresh), division);
    }

    @GetMapping("/bracket/{division}")
    public BracketDTO bracket(@PathVariable String league,
                              @PathVariable String division,
                              @RequestParam(value = "fresh", defaultValue = "true") boolean fresh) {
        return bracketService.buildBracket(runService.snapshot(league, fresh), division)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Division not found: " + division));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> invalidate(@PathVariable String league) {
        runService.startRun(league);
        return ResponseEntity.noContent().build();
    }

    // A filter naming nothing is a caller error, not an empty result.
    private void requireKnownFilter(LeagueSnapshot snapshot, String division) {
        if (division == null || division.isBlank()) return;
        DivisionSelection selection = divisionSelector.select(division, snapshot.divisionList(), snapshot.conferenceList());
        if (selection.scope() == DivisionSelection.Scope.NONE && !snapshot.divisionList().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown division filter: " + division);
        }
    }
}
