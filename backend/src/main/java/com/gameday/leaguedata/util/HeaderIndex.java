package com.gameday.leaguedata.util;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Column-name lookup over a parsed sheet. Builders read fields by header name so that
 * column reordering in the upstream sheet does not break them.
 */
public final class HeaderIndex {

    private final Map<String, Integer> positions;

    private HeaderIndex(Map<String, Integer> positions) {
        this.positions = positions;
    }

    public static HeaderIndex of(List<String> headerRow) {
        Map<String, Integer> map = new HashMap<>();
        if (headerRow != null) {
            for (int i = 0; i < headerRow.size(); i++) {
                map.put(headerRow.get(i), i);
            }
        }
        return new HeaderIndex(map);
    }

    /** Builds the index from the row at {@code headerRowIndex}, or an empty index when the sheet is shorter. */
    public static HeaderIndex of(List<List<String>> rows, int headerRowIndex) {
        if (rows == null || headerRowIndex < 0 || rows.size() <= headerRowIndex) {
            return new HeaderIndex(Collections.emptyMap());
        }
        return of(rows.get(headerRowIndex));
    }

    public boolean has(String column) {
        return positions.containsKey(column);
    }

    public String get(List<String> row, String column) {
        Integer idx = positions.get(column);
        if (idx == null || row == null || idx >= row.size()) return "";
        String v = row.get(idx);
        return v == null ? "" : v;
    }

    public int size() {
        return positions.size();
    }
}
