package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.GoalieStatLine;
import com.gameday.leaguedata.util.HeaderIndex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.gameday.leaguedata.util.SheetValues.toDouble;
import static com.gameday.leaguedata.util.SheetValues.toInt;

@Component
public class GoalieStatBuilder implements SheetBuilder<GoalieStatLine> {

    /** Teams list a stand-in goalie under this name; those rows are not real players. */
    static final String BACKUP_PLACEHOLDER = "backup goalie";

    @Override
    public List<GoalieStatLine> build(List<List<String>> rows) {
        List<GoalieStatLine> out = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return out;

        HeaderIndex h = HeaderIndex.of(rows.get(0));
        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            String first = h.get(row, "First Name");
            String last = h.get(row, "Last Name");
            String fullName = first + " " + last;

            if (BACKUP_PLACEHOLDER.equals(fullName.trim().toLowerCase(Locale.ROOT))) continue;

            String team = h.get(row, "Team");
            if (team.isEmpty()) continue;

            out.add(new GoalieStatLine(
                    first,
                    last,
                    fullName,
                    team,
                    h.get(row, "Division"),
                    toInt(h.get(row, "GA")),
                    toDouble(h.get(row, "GAA")),
                    toInt(h.get(row, "GP"))
            ));
        }
        return out;
    }
}
