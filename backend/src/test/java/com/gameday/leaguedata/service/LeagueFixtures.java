package com.gameday.leaguedata.service;

import com.gameday.leaguedata.builder.ConferenceBuilder;
import com.gameday.leaguedata.builder.DivisionBuilder;
import com.gameday.leaguedata.builder.GoalieStatBuilder;
import com.gameday.leaguedata.builder.PlayerStatBuilder;
import com.gameday.leaguedata.builder.ScheduleBuilder;
import com.gameday.leaguedata.builder.StandingsBuilder;
import com.gameday.leaguedata.builder.TeamBuilder;
import com.gameday.leaguedata.config.LeagueSourceSettings;
import com.gameday.leaguedata.exception.ResourceFetchException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/** Sheet texts for a small two-conference league, served from memory. */
final class LeagueFixtures {

    static final String REGISTRY = "mem://registry";
    static final Executor DIRECT = Runnable::run;

    static final String REGISTRY_CSV = """
            LEAGUE,DIVISION INFO,TEAM INFO,SCHEDULE,STANDINGS,GOALIE STATS,PLAYER STATS
            Metro Hockey,mem://div,mem://teams,mem://schedule,mem://standings,mem://goalies,mem://players
            Broken League,mem://div,,mem://schedule,mem://standings,mem://goalies,mem://players
            """;

    static final String DIVISIONS_CSV = """
            Conference,Division,Abb,Color,Time Zone,Location,Short
            East,North,EN,#112233,America/New_York,Boston,N
            East,South,ES,#223344,America/New_York,Miami,S
            West,Coast,WC,#334455,America/Los_Angeles,Seattle,C
            """;

    static final String TEAMS_CSV = """
            Conference,Division,Abb,City,Name,Color 1,Color 2,Full Name
            East,North,ROC,Boston,Rockets,#111,#222,Boston Rockets
            East,North,COM,Albany,Comets,#333,#444,Albany Comets
            """;

    static final String STANDINGS_CSV = """
            RANK,Team Name,Division,GP,W,OTW,OTL,L,PTS,DIFF,P%,GF,GA
            2,Albany Comets,East North,6,3,0,1,2,7,1,0.583,20,19
            1,Boston Rockets,East North,6,5,0,0,1,10,9,0.833,25,16
            ,Late Entry,East North,0,0,0,0,0,0,0,#DIV/0!,0,0
            1,Seattle Storm,West Coast,6,4,0,0,2,8,3,0.667,21,18
            """;

    static final String SCHEDULE_CSV = """
            All Games
            ,Current,6,2024
            Week,Game Type,Season,Date,Date Short,Day,Time,Team 1,Div 1,Score 1,Team 2,Div 2,Score 2,Final,Location,Seed 1,Seed 2,Round
            5,Regular Season,Fall 2024,"Saturday, Oct 5",10/5,Sat,7:00 PM,Boston Rockets,East North,3,Albany Comets,East North,2,F,Rink 1,,,
            6,Regular Season,Fall 2024,"Saturday, Oct 12",10/12,Sat,7:00 PM,Boston Rockets,East North,4,Albany Comets,East North,1,F,Rink 1,,,
            6,Regular Season,Fall 2024,"Saturday, Oct 12",10/12,Sat,9:00 PM,Seattle Storm,West Coast,,Portland Pines,West Coast,,,Rink 2,,,
            7,Playoffs,Fall 2024,"Saturday, Oct 19",10/19,Sat,7:00 PM,Boston Rockets,East North,,Albany Comets,East North,,,Rink 1,1,2,Final
            """;

    static final String PLAYERS_CSV = """
            First Name,Last Name,Team,Division,G,A,PTS,PTS/GP
            Jo,Park,Boston Rockets,East North,6,4,10,1.67
            Sam,Lee,Boston Rockets,East North,3,7,10,1.67
            Ana,Ruiz,Albany Comets,East North,5,1,6,1.00
            Tom,Ng,Albany Comets,East North,1,2,3,0.50
            Eli,Fox,Boston Rockets,East North,0,2,2,0.33
            Ray,Cho,Seattle Storm,West Coast,4,4,8,1.33
            """;

    static final String GOALIES_CSV = """
            First Name,Last Name,Team,Division,GA,GAA,GP
            Kim,Ortiz,Boston Rockets,East North,16,2.67,6
            Backup,Goalie,Albany Comets,East North,3,3.00,1
            Lou,Hart,Albany Comets,East North,19,3.17,6
            """;

    private LeagueFixtures() {}

    static Map<String, String> sheets() {
        Map<String, String> m = new HashMap<>();
        m.put(REGISTRY, REGISTRY_CSV);
        m.put("mem://div", DIVISIONS_CSV);
        m.put("mem://teams", TEAMS_CSV);
        m.put("mem://schedule", SCHEDULE_CSV);
        m.put("mem://standings", STANDINGS_CSV);
        m.put("mem://goalies", GOALIES_CSV);
        m.put("mem://players", PLAYERS_CSV);
        return m;
    }

    static LeagueSourceSettings settings() {
        return new LeagueSourceSettings(REGISTRY, 1000, 1000, "test");
    }

    /** Serves sheets from a map and counts fetches per location. Unknown locations fail. */
    static final class MemoryFetcher implements ResourceFetcher {
        final Map<String, String> sheets;
        final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        MemoryFetcher(Map<String, String> sheets) {
            this.sheets = sheets;
        }

        @Override
        public String fetch(String location) {
            calls.computeIfAbsent(location, k -> new AtomicInteger()).incrementAndGet();
            String text = sheets.get(location);
            if (text == null) throw new ResourceFetchException(location, "HTTP 404 while fetching " + location);
            return text;
        }

        int callsTo(String location) {
            AtomicInteger n = calls.get(location);
            return n == null ? 0 : n.get();
        }
    }

    static LeagueDataService dataService(ResourceFetcher fetcher, LeagueRunCache cache) {
        return dataService(fetcher, cache, DIRECT);
    }

    static LeagueDataService dataService(ResourceFetcher fetcher, LeagueRunCache cache, Executor executor) {
        LeagueRegistryService registry = new LeagueRegistryService(fetcher, cache, settings(), executor);
        return new LeagueDataService(registry, cache, fetcher, executor,
                new DivisionBuilder(), new ConferenceBuilder(), new TeamBuilder(), new StandingsBuilder(),
                new ScheduleBuilder(new DivisionJoinResolver()), new PlayerStatBuilder(), new GoalieStatBuilder());
    }
}
