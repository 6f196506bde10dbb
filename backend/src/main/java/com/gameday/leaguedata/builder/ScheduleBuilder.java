package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.GameType;
import com.gameday.leaguedata.model.LeagueSource;
import com.gameday.leaguedata.model.ScheduleSheet;
import com.gameday.leaguedata.service.DivisionJoinResolver;
import com.gameday.leaguedata.util.HeaderIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.gameday.leaguedata.util.SheetValues.cell;
import static com.gameday.leaguedata.util.SheetValues.toDoubleOrNull;
import static com.gameday.leaguedata.util.SheetValues.toInt;

/**
 * "All games" sheet. Rows 0 and 1 carry metadata, row 2 is the header, games follow.
 * Both division labels of every game are joined against the division list.
 */
@Component
public class ScheduleBuilder {

    private static final Logger log = LoggerFactory.getLogger(ScheduleBuilder.class);

    private final DivisionJoinResolver joinResolver;

    public ScheduleBuilder(DivisionJoinResolver joinResolver) {
        this.joinResolver = joinResolver;
    }

    public ScheduleSheet build(List<List<String>> rows, List<Division> divisions) {
        if (rows == null || rows.isEmpty()) return ScheduleSheet.EMPTY;

        int headerRow = LeagueSource.SCHEDULE.headerRow();
        HeaderIndex h = HeaderIndex.of(rows, headerRow);
        int[] weekAndYear = readWeekAndYear(rows);

        List<Game> games = new ArrayList<>();
        int skipped = 0;
        // The header row is scanned too; its "Week" cell is not a number, so it drops out.
        for (int n = headerRow; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            if (row == null || row.isEmpty()) continue;

            Integer week = parseWeek(h.get(row, "Week"));
            if (week == null) {
                skipped++;
                continue;
            }

            String typeLabel = h.get(row, "Game Type");
            games.add(new Game(
                    week,
                    GameType.fromLabel(typeLabel),
                    typeLabel,
                    h.get(row, "Season"),
                    h.get(row, "Date"),
                    h.get(row, "Date Short"),
                    h.get(row, "Day"),
                    h.get(row, "Time"),
                    h.get(row, "Team 1"),
                    joinResolver.resolve(h.get(row, "Div 1"), divisions),
                    h.get(row, "Score 1"),
                    h.get(row, "Team 2"),
                    joinResolver.resolve(h.get(row, "Div 2"), divisions),
                    h.get(row, "Score 2"),
                    h.get(row, "Final"),
                    h.get(row, "Location"),
                    h.get(row, "Seed 1"),
                    h.get(row, "Seed 2"),
                    h.get(row, "Round")
            ));
        }
        log.debug("[Schedule] Built {} games (week {}, year {}), skipped {} rows", games.size(), weekAndYear[0], weekAndYear[1], skipped);
        return new ScheduleSheet(games, weekAndYear[0], weekAndYear[1]);
    }

    /**
     * Week and year of the sheet, from cells [1][2] and [1][3].
     * Schema-fragile: these are positional and change if the sheet's metadata block moves.
     */
    static int[] readWeekAndYear(List<List<String>> rows) {
        if (rows.size() < 2) return new int[]{0, 0};
        List<String> meta = rows.get(1);
        return new int[]{toInt(cell(meta, 2)), toInt(cell(meta, 3))};
    }

    /** Null for blank, non-numeric, fractional or negative weeks. */
    static Integer parseWeek(String raw) {
        Double d = toDoubleOrNull(raw);
        if (d == null || d < 0 || d != Math.floor(d)) return null;
        return d.intValue();
    }
}
