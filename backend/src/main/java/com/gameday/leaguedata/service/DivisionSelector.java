package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.GameType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Turns the user's division filter into the divisions a run works on. */
@Component
public class DivisionSelector {

    public static final String ALL = "ALL";

    /**
     * Filter forms, tried in order: blank or "ALL"; a division abbreviation; a
     * "{conference} {division}" label; a conference name. Matching ignores case.
     */
    public DivisionSelection select(String filter, List<Division> divisions, List<Conference> conferences) {
        String f = filter == null ? "" : filter.trim().toUpperCase(Locale.ROOT);
        if (f.isEmpty() || ALL.equals(f)) {
            return new DivisionSelection(ALL, DivisionSelection.Scope.ALL, null, List.copyOf(divisions));
        }
        for (Division d : divisions) {
            if (f.equals(d.abbreviation().toUpperCase(Locale.ROOT))
                    || f.equals(d.fullName().toUpperCase(Locale.ROOT))) {
                return new DivisionSelection(f, DivisionSelection.Scope.DIVISION, d.conference(), List.of(d));
            }
        }
        for (Conference c : conferences) {
            if (f.equals(c.name().toUpperCase(Locale.ROOT))) {
                List<Division> inConf = divisions.stream()
                        .filter(d -> d.conference().equals(c.name()))
                        .toList();
                return new DivisionSelection(f, DivisionSelection.Scope.CONFERENCE, c.name(), inConf);
            }
        }
        return new DivisionSelection(f, DivisionSelection.Scope.NONE, null, List.of());
    }

    /**
     * Selected divisions with at least one game in {@code week} or the week after. With
     * {@code includeIdle} every selected division is kept.
     */
    public List<Division> activeDivisions(DivisionSelection selection, List<Game> games, int week, boolean includeIdle) {
        return activeDivisions(selection, games, week, includeIdle, null);
    }

    /** As above, counting only games of {@code type} (null counts all games). */
    public List<Division> activeDivisions(DivisionSelection selection, List<Game> games, int week,
                                          boolean includeIdle, GameType type) {
        if (includeIdle) return selection.divisions();
        List<Division> active = new ArrayList<>();
        for (Division d : selection.divisions()) {
            String label = d.fullName();
            boolean hasGame = games.stream().anyMatch(g -> g.inWindow(week)
                    && (type == null || g.gameType() == type)
                    && label.equals(g.division1().fullName()));
            if (hasGame) active.add(d);
        }
        return active;
    }
}
