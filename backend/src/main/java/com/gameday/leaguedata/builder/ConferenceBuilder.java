package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.Conference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.gameday.leaguedata.util.SheetValues.cell;

/**
 * Conferences come from the division info sheet: the first row of each conference
 * supplies its color, time zone and location.
 */
@Component
public class ConferenceBuilder implements SheetBuilder<Conference> {

    @Override
    public List<Conference> build(List<List<String>> rows) {
        List<Conference> confs = new ArrayList<>();
        if (rows == null) return confs;

        Set<String> seen = new LinkedHashSet<>();
        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            String name = cell(row, 0);
            if (name.isEmpty() || !seen.add(name)) continue;
            confs.add(new Conference(name, cell(row, 3), cell(row, 4), cell(row, 5)));
        }
        return confs;
    }
}
