package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.StandingsRow;
import com.gameday.leaguedata.util.HeaderIndex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.gameday.leaguedata.util.SheetValues.toDouble;
import static com.gameday.leaguedata.util.SheetValues.toInt;
import static com.gameday.leaguedata.util.SheetValues.toIntOrNull;

@Component
public class StandingsBuilder implements SheetBuilder<StandingsRow> {

    /** What the sheet shows for P% before a team has played. */
    static final String DIV_ZERO_MARKER = "#DIV/0!";

    @Override
    public List<StandingsRow> build(List<List<String>> rows) {
        List<StandingsRow> out = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return out;

        HeaderIndex h = HeaderIndex.of(rows.get(0));
        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            if (row == null || row.isEmpty()) continue;

            String team = h.get(row, "Team Name");
            if (team.isEmpty()) continue;

            String pct = h.get(row, "P%");
            if (DIV_ZERO_MARKER.equals(pct)) pct = "0.000";

            out.add(new StandingsRow(
                    team,
                    h.get(row, "Division"),
                    toInt(h.get(row, "GP")),
                    toInt(h.get(row, "W")),
                    toInt(h.get(row, "OTW")),
                    toInt(h.get(row, "OTL")),
                    toInt(h.get(row, "L")),
                    toInt(h.get(row, "PTS")),
                    toInt(h.get(row, "DIFF")),
                    toDouble(pct),
                    toInt(h.get(row, "GF")),
                    toInt(h.get(row, "GA")),
                    toIntOrNull(h.get(row, "RANK"))
            ));
        }
        return out;
    }
}
