package com.gameday.leaguedata.builder;

import com.gameday.leaguedata.model.Division;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.gameday.leaguedata.util.SheetValues.cell;

/**
 * Division info sheet. Columns are read by position: conference, division, abbreviation,
 * color 1, color 2, (time zone / location used by conferences), short label.
 */
@Component
public class DivisionBuilder implements SheetBuilder<Division> {

    private static final Logger log = LoggerFactory.getLogger(DivisionBuilder.class);

    @Override
    public List<Division> build(List<List<String>> rows) {
        List<Division> divisions = new ArrayList<>();
        if (rows == null) return divisions;

        Set<String> abbreviations = new HashSet<>();
        for (int n = 1; n < rows.size(); n++) {
            List<String> row = rows.get(n);
            String conf = cell(row, 0);
            String div = cell(row, 1);
            if (conf.isEmpty() && div.isEmpty()) continue;

            Division d = new Division(conf, div, cell(row, 2), cell(row, 3), cell(row, 4), cell(row, 6));
            if (!d.abbreviation().isEmpty() && !abbreviations.add(d.abbreviation())) {
                log.warn("[Divisions] Duplicate abbreviation {} at row {}; joins will use the first one", d.abbreviation(), n);
            }
            divisions.add(d);
        }
        log.debug("[Divisions] Built {} divisions", divisions.size());
        return divisions;
    }
}
