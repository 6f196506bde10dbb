package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.LeagueResources;
import com.gameday.leaguedata.model.LeagueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for one generation run. A fresh run drops whatever the league's cache holds,
 * so every sheet is fetched at most once per run and never reused across runs.
 */
@Service
public class LeagueRunService {

    private static final Logger log = LoggerFactory.getLogger(LeagueRunService.class);

    private final LeagueDataService dataService;
    private final LeagueRegistryService registry;
    private final LeagueRunCache cache;

    public LeagueRunService(LeagueDataService dataService, LeagueRegistryService registry, LeagueRunCache cache) {
        this.dataService = dataService;
        this.registry = registry;
        this.cache = cache;
    }

    public LeagueSnapshot snapshot(String league, boolean fresh) {
        if (fresh) startRun(league);
        return dataService.loadSnapshot(league);
    }

    public LeagueResources resources(String league, boolean fresh) {
        if (fresh) startRun(league);
        return registry.resolve(league);
    }

    public void startRun(String league) {
        log.debug("[Run] Starting fresh run for '{}'", league);
        cache.invalidate(league);
    }
}
