package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.Team;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.gameday.leaguedata.util.SheetValues.cell;

/** Team info sheet, read by position. Rows without a full team name are dropped. */
@Component
public class TeamBuilder implements SheetBuilder<Team> {

    @Override
    public List<Team> build(List<List<String>> rows) {
        List<Team> teams = new ArrayList<>();
        if (rows == null) return teams;

        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            String fullName = cell(row, 7);
            if (fullName.isEmpty()) continue;
            teams.add(new Team(
                    cell(row, 0),
                    cell(row, 1),
                    cell(row, 2),
                    cell(row, 3),
                    cell(row, 4),
                    fullName,
                    cell(row, 5),
                    cell(row, 6)
            ));
        }
        return teams;
    }
}
