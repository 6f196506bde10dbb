package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.LeagueSnapshot;
import com.gameday.leaguedata.model.SourceStatus;
import com.gameday.leaguedata.model.StandingsRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LeagueDataServiceTest {

    private Map<String, String> sheets;
    private LeagueFixtures.MemoryFetcher fetcher;
    private LeagueDataService service;

    @BeforeEach
    void setup() {
        sheets = LeagueFixtures.sheets();
        fetcher = new LeagueFixtures.MemoryFetcher(sheets);
        service = LeagueFixtures.dataService(fetcher, new LeagueRunCache());
    }

    @Test
    void snapshotLoadsEverySheet() {
        LeagueSnapshot snap = service.loadSnapshot("Metro Hockey");

        assertThat(snap.divisionList()).hasSize(3);
        assertThat(snap.conferenceList()).hasSize(2);
        assertThat(snap.teamList()).hasSize(2);
        assertThat(snap.standingsRows()).extracting(StandingsRow::teamFullName).contains("Late Entry");
        assertThat(snap.games()).hasSize(4);
        assertThat(snap.week()).isEqualTo(6);
        assertThat(snap.year()).isEqualTo(2024);
        assertThat(snap.players()).hasSize(6);
        assertThat(snap.goalies()).hasSize(2);
        assertThat(snap.games().get(0).division1().abbreviation()).isEqualTo("EN");
        assertThat(snap.games().get(0).date()).isEqualTo("Saturday, Oct 5");
    }

    @Test
    void eachSheetIsFetchedOncePerRun() {
        service.loadSnapshot("Metro Hockey");
        service.loadSnapshot("Metro Hockey");

        // divisions feed divisions, conferences and the schedule join
        assertEquals(1, fetcher.callsTo("mem://div"));
        assertEquals(1, fetcher.callsTo("mem://schedule"));
        assertEquals(1, fetcher.callsTo(LeagueFixtures.REGISTRY));
    }

    @Test
    void unreachableSheetDegradesToUnavailable() {
        sheets.remove("mem://goalies");

        LeagueSnapshot snap = service.loadSnapshot("Metro Hockey");

        assertThat(snap.goalieStats().status()).isEqualTo(SourceStatus.UNAVAILABLE);
        assertThat(snap.goalieStats().message()).contains("mem://goalies");
        assertThat(snap.goalies()).isEmpty();
        assertThat(snap.playerStats().status()).isEqualTo(SourceStatus.OK);
    }

    @Test
    void scheduleLoadsWithoutDivisionsButJoinsNothing() {
        sheets.remove("mem://div");

        LeagueSnapshot snap = service.loadSnapshot("Metro Hockey");

        assertThat(snap.divisions().isAvailable()).isFalse();
        assertThat(snap.games()).hasSize(4);
        assertThat(snap.games()).allSatisfy(g -> assertThat(g.division1().isResolved()).isFalse());
    }

    @Test
    void emptySheetIsEmptyNotUnavailable() {
        sheets.put("mem://teams", "Conference,Division,Abb,City,Name,Color 1,Color 2,Full Name\n");

        assertThat(service.loadTeams("Metro Hockey").status()).isEqualTo(SourceStatus.EMPTY);
    }

    @Test
    void unknownLeagueGivesAnUnavailableSnapshot() {
        LeagueSnapshot snap = service.loadSnapshot("Nowhere");

        assertThat(snap.divisions().status()).isEqualTo(SourceStatus.UNAVAILABLE);
        assertThat(snap.schedule().message()).contains("Nowhere");
        assertThat(snap.games()).isEmpty();
        assertThat(snap.week()).isZero();
        assertEquals(1, fetcher.callsTo(LeagueFixtures.REGISTRY));
    }

    @Test
    void saturatedFetchPoolGivesAnUnavailableSnapshot() {
        LeagueRunCache cache = new LeagueRunCache();
        LeagueDataService saturated = LeagueFixtures.dataService(fetcher, cache, task -> {
            throw new RejectedExecutionException("pool full");
        });

        LeagueSnapshot snap = saturated.loadSnapshot("Metro Hockey");

        assertThat(snap.divisions().status()).isEqualTo(SourceStatus.UNAVAILABLE);
        assertThat(snap.standings().message()).contains("pool full");
        assertThat(snap.games()).isEmpty();
        assertEquals(0, cache.size());
    }
}
