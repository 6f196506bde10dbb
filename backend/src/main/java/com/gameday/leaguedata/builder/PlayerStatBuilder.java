package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.PlayerStatLine;
import com.gameday.leaguedata.util.HeaderIndex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.gameday.leaguedata.util.SheetValues.toDouble;
import static com.gameday.leaguedata.util.SheetValues.toInt;

@Component
public class PlayerStatBuilder implements SheetBuilder<PlayerStatLine> {

    @Override
    public List<PlayerStatLine> build(List<List<String>> rows) {
        List<PlayerStatLine> out = new ArrayList<>();
        if (rows == null || rows.isEmpty()) return out;

        HeaderIndex h = HeaderIndex.of(rows.get(0));
        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            String team = h.get(row, "Team");
            if (team.isEmpty()) continue;

            String first = h.get(row, "First Name");
            String last = h.get(row, "Last Name");
            out.add(new PlayerStatLine(
                    first,
                    last,
                    first + " " + last,
                    team,
                    h.get(row, "Division"),
                    toInt(h.get(row, "G")),
                    toInt(h.get(row, "A")),
                    toInt(h.get(row, "PTS")),
                    toDouble(h.get(row, "PTS/GP"))
            ));
        }
        return out;
    }
}
