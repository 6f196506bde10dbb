package com.gameday.leaguedata.service;

import com.gameday.leaguedata.config.LeagueSourceSettings;
import com.gameday.leaguedata.exception.LeagueConfigurationException;
import com.gameday.leaguedata.exception.ResourceFetchException;
import com.gameday.leaguedata.model.LeagueResources;
import com.gameday.leaguedata.model.LeagueSource;
import com.gameday.leaguedata.util.Futures;
import com.gameday.leaguedata.util.HeaderIndex;
import com.gameday.leaguedata.util.TabularParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Looks a league up in the master registry sheet, which maps each league name to the
 * locations of its six data sheets.
 */
@Service
public class LeagueRegistryService {

    private static final Logger log = LoggerFactory.getLogger(LeagueRegistryService.class);

    static final String LEAGUE_COLUMN = "LEAGUE";

    private final ResourceFetcher fetcher;
    private final LeagueRunCache cache;
    private final LeagueSourceSettings settings;
    private final Executor executor;

    public LeagueRegistryService(ResourceFetcher fetcher,
                                 LeagueRunCache cache,
                                 LeagueSourceSettings settings,
                                 @Qualifier("leagueFetchExecutor") Executor leagueFetchExecutor) {
        this.fetcher = fetcher;
        this.cache = cache;
        this.settings = settings;
        this.executor = leagueFetchExecutor;
    }

    /**
     * @throws LeagueConfigurationException when the league is missing from the registry or
     *         any of its six locations is blank
     */
    public LeagueResources resolve(String leagueName) {
        return Futures.join(resolveAsync(leagueName));
    }

    public CompletableFuture<LeagueResources> resolveAsync(String leagueName) {
        String name = leagueName == null ? "" : leagueName.trim();
        if (name.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new LeagueConfigurationException(name, "League name is missing; cannot resolve its registry row"));
        }
        return cache.resources(name, () -> CompletableFuture.supplyAsync(() -> lookup(name), executor));
    }

    LeagueResources lookup(String leagueName) {
        String registryUrl = settings.getRegistryUrl();
        String text;
        try {
            text = fetcher.fetch(registryUrl);
        } catch (ResourceFetchException e) {
            log.warn("[Registry] Fetch failed for league '{}': {}", leagueName, e.getMessage());
            throw new LeagueConfigurationException(leagueName, notFound(leagueName), e);
        }

        List<List<String>> rows = TabularParser.parse(text);
        if (rows.isEmpty()) {
            log.warn("[Registry] Master registry at {} is empty", registryUrl);
            throw new LeagueConfigurationException(leagueName, notFound(leagueName));
        }

        HeaderIndex h = HeaderIndex.of(rows.get(0));
        for (int i = 1; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String league = h.get(row, LEAGUE_COLUMN).trim();
            if (league.isEmpty() || !league.equalsIgnoreCase(leagueName)) continue;

            LeagueResources res = new LeagueResources(
                    leagueName,
                    column(h, row, LeagueSource.DIVISIONS),
                    column(h, row, LeagueSource.TEAMS),
                    column(h, row, LeagueSource.SCHEDULE),
                    column(h, row, LeagueSource.STANDINGS),
                    column(h, row, LeagueSource.GOALIE_STATS),
                    column(h, row, LeagueSource.PLAYER_STATS));
            for (LeagueSource source : LeagueSource.values()) {
                if (res.locationOf(source).isEmpty()) {
                    log.warn("[Registry] League '{}' has no {} location", leagueName, source.registryColumn());
                    throw new LeagueConfigurationException(leagueName, notFound(leagueName));
                }
            }
            log.info("[Registry] Resolved league '{}'", leagueName);
            return res;
        }

        log.warn("[Registry] League '{}' not present in master registry", leagueName);
        throw new LeagueConfigurationException(leagueName, notFound(leagueName));
    }

    private static String column(HeaderIndex h, List<String> row, LeagueSource source) {
        return h.get(row, source.registryColumn()).trim();
    }

    private static String notFound(String leagueName) {
        return "League \"" + leagueName + "\" not found or incomplete in master league registry";
    }
}
