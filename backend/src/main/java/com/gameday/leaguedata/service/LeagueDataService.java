package com.gameday.leaguedata.service;

import com.gameday.leaguedata.builder.ConferenceBuilder;
import com.gameday.leaguedata.builder.DivisionBuilder;
import com.gameday.leaguedata.builder.GoalieStatBuilder;
import com.gameday.leaguedata.builder.PlayerStatBuilder;
import com.gameday.leaguedata.builder.ScheduleBuilder;
import com.gameday.leaguedata.builder.SheetBuilder;
import com.gameday.leaguedata.builder.StandingsBuilder;
import com.gameday.leaguedata.builder.TeamBuilder;
import com.gameday.leaguedata.exception.LeagueConfigurationException;
import com.gameday.leaguedata.exception.ResourceFetchException;
import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.GoalieStatLine;
import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.model.LeagueSource;
import com.gameday.leaguedata.model.PlayerStatLine;
import com.gameday.leaguedata.model.ScheduleSheet;
import com.gameday.leaguedata.model.SourceResult;
import com.gameday.leaguedata.model.StandingsRow;
import com.gameday.leaguedata.model.Team;
import com.gameday.leaguedata.util.Futures;
import com.gameday.leaguedata.util.TabularParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads the league sheets and turns them into entity collections.
 * <p>
 * A sheet that cannot be fetched (or a league that is not in the registry) never fails the
 * caller: the loader logs it and returns an UNAVAILABLE result with empty data, so the
 * other sheets still load.
 */
@Service
public class LeagueDataService {

    private static final Logger log = LoggerFactory.getLogger(LeagueDataService.class);

    private final LeagueRegistryService registry;
    private final LeagueRunCache cache;
    private final ResourceFetcher fetcher;
    private final Executor executor;
    private final DivisionBuilder divisionBuilder;
    private final ConferenceBuilder conferenceBuilder;
    private final TeamBuilder teamBuilder;
    private final StandingsBuilder standingsBuilder;
    private final ScheduleBuilder scheduleBuilder;
    private final PlayerStatBuilder playerStatBuilder;
    private final GoalieStatBuilder goalieStatBuilder;

    public LeagueDataService(LeagueRegistryService registry,
                             LeagueRunCache cache,
                             ResourceFetcher fetcher,
                             @Qualifier("leagueFetchExecutor") Executor leagueFetchExecutor,
                             DivisionBuilder divisionBuilder,
                             ConferenceBuilder conferenceBuilder,
                             TeamBuilder teamBuilder,
                             StandingsBuilder standingsBuilder,
                             ScheduleBuilder scheduleBuilder,
                             PlayerStatBuilder playerStatBuilder,
                             GoalieStatBuilder goalieStatBuilder) {
        this.registry = registry;
        this.cache = cache;
        this.fetcher = fetcher;
        this.executor = leagueFetchExecutor;
        this.divisionBuilder = divisionBuilder;
        this.conferenceBuilder = conferenceBuilder;
        this.teamBuilder = teamBuilder;
        this.standingsBuilder = standingsBuilder;
        this.scheduleBuilder = scheduleBuilder;
        this.playerStatBuilder = playerStatBuilder;
        this.goalieStatBuilder = goalieStatBuilder;
    }

    public SourceResult<List<Division>> loadDivisions(String league) {
        return Futures.join(divisionsAsync(league));
    }

    public SourceResult<List<Conference>> loadConferences(String league) {
        return Futures.join(listAsync(league, LeagueSource.DIVISIONS, conferenceBuilder, "conferences"));
    }

    public SourceResult<List<Team>> loadTeams(String league) {
        return Futures.join(listAsync(league, LeagueSource.TEAMS, teamBuilder, "teams"));
    }

    public SourceResult<List<StandingsRow>> loadStandings(String league) {
        return Futures.join(listAsync(league, LeagueSource.STANDINGS, standingsBuilder, "standings"));
    }

    public SourceResult<List<PlayerStatLine>> loadPlayerStats(String league) {
        return Futures.join(listAsync(league, LeagueSource.PLAYER_STATS, playerStatBuilder, "player stats"));
    }

    public SourceResult<List<GoalieStatLine>> loadGoalieStats(String league) {
        return Futures.join(listAsync(league, LeagueSource.GOALIE_STATS, goalieStatBuilder, "goalie stats"));
    }

    public SourceResult<ScheduleSheet> loadSchedule(String league) {
        return Futures.join(scheduleAsync(league, divisionsAsync(league)));
    }

    /**
     * Loads every sheet of the league. The registry row is resolved first; the sheet
     * fetches then run in parallel on the fetch executor.
     */
    public LeagueSnapshot loadSnapshot(String league) {
        long t0 = System.currentTimeMillis();
        try {
            registry.resolve(league);
        } catch (LeagueConfigurationException e) {
            log.warn("[LeagueData] League '{}' unresolved: {}", league, e.getMessage());
            return unavailableSnapshot(league, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[LeagueData] Registry lookup for '{}' failed", league, e);
            return unavailableSnapshot(league, "Registry lookup failed: " + e.getMessage());
        }

        CompletableFuture<SourceResult<List<Division>>> divisions = divisionsAsync(league);
        CompletableFuture<SourceResult<List<Conference>>> conferences = listAsync(league, LeagueSource.DIVISIONS, conferenceBuilder, "conferences");
        CompletableFuture<SourceResult<List<Team>>> teams = listAsync(league, LeagueSource.TEAMS, teamBuilder, "teams");
        CompletableFuture<SourceResult<List<StandingsRow>>> standings = listAsync(league, LeagueSource.STANDINGS, standingsBuilder, "standings");
        CompletableFuture<SourceResult<ScheduleSheet>> schedule = scheduleAsync(league, divisions);
        CompletableFuture<SourceResult<List<PlayerStatLine>>> players = listAsync(league, LeagueSource.PLAYER_STATS, playerStatBuilder, "player stats");
        CompletableFuture<SourceResult<List<GoalieStatLine>>> goalies = listAsync(league, LeagueSource.GOALIE_STATS, goalieStatBuilder, "goalie stats");

        CompletableFuture.allOf(divisions, conferences, teams, standings, schedule, players, goalies).join();

        LeagueSnapshot snapshot = new LeagueSnapshot(league,
                divisions.join(), conferences.join(), teams.join(), standings.join(),
                schedule.join(), players.join(), goalies.join());
        log.info("[LeagueData] league='{}' divisions={} teams={} standings={} games={} players={} goalies={} week={} in {} ms",
                league, snapshot.divisionList().size(), snapshot.teamList().size(), snapshot.standingsRows().size(),
                snapshot.games().size(), snapshot.players().size(), snapshot.goalies().size(), snapshot.week(),
                System.currentTimeMillis() - t0);
        return snapshot;
    }

    CompletableFuture<List<List<String>>> sheet(String league, LeagueSource source) {
        return registry.resolveAsync(league).thenCompose(res ->
                cache.sheet(league, source, () -> CompletableFuture.supplyAsync(
                        () -> TabularParser.parse(fetcher.fetch(res.locationOf(source))), executor)));
    }

    private CompletableFuture<SourceResult<List<Division>>> divisionsAsync(String league) {
        return listAsync(league, LeagueSource.DIVISIONS, divisionBuilder, "divisions");
    }

    private <T> CompletableFuture<SourceResult<List<T>>> listAsync(String league, LeagueSource source,
                                                                   SheetBuilder<T> builder, String what) {
        return sheet(league, source)
                .thenApply(rows -> {
                    List<T> items = builder.build(rows);
                    log.info("[LeagueData] Built {} {} for '{}'", items.size(), what, league);
                    return SourceResult.ofList(items);
                })
                .exceptionally(ex -> SourceResult.unavailable(List.of(), describeFailure(league, what, ex)));
    }

    private CompletableFuture<SourceResult<ScheduleSheet>> scheduleAsync(String league,
                                                                        CompletableFuture<SourceResult<List<Division>>> divisions) {
        return sheet(league, LeagueSource.SCHEDULE)
                .thenCombine(divisions, (rows, divs) -> {
                    ScheduleSheet sheet = scheduleBuilder.build(rows, divs.data());
                    log.info("[LeagueData] Built {} games for '{}' (week {}, year {})",
                            sheet.games().size(), league, sheet.week(), sheet.year());
                    return SourceResult.ofSchedule(sheet);
                })
                .exceptionally(ex -> SourceResult.unavailable(ScheduleSheet.EMPTY, describeFailure(league, "schedule", ex)));
    }

    private static LeagueSnapshot unavailableSnapshot(String league, String message) {
        return new LeagueSnapshot(league,
                SourceResult.unavailable(List.of(), message),
                SourceResult.unavailable(List.of(), message),
                SourceResult.unavailable(List.of(), message),
                SourceResult.unavailable(List.of(), message),
                SourceResult.unavailable(ScheduleSheet.EMPTY, message),
                SourceResult.unavailable(List.of(), message),
                SourceResult.unavailable(List.of(), message));
    }

    private static String describeFailure(String league, String what, Throwable ex) {
        RuntimeException cause = Futures.unwrap(ex);
        if (cause instanceof ResourceFetchException || cause instanceof LeagueConfigurationException) {
            log.warn("[LeagueData] {} unavailable for '{}': {}", what, league, cause.getMessage());
        } else {
            log.warn("[LeagueData] {} failed to load for '{}'", what, league, cause);
        }
        return cause.getMessage();
    }
}
