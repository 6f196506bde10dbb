package com.gameday.leaguedata.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient parser for the comma-delimited text published by the league sheets.
 * <p>
 * Each literal quote toggles the quoted state and is dropped; commas inside a quoted
 * span are kept. Escaped quotes are not recognised, and an unterminated quote simply
 * makes the rest of the line quoted. Hand-edited sheets rely on this, so the parser
 * never fails.
 */
public final class TabularParser {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';

    private TabularParser() {}

    public static List<List<String>> parse(String text) {
        List<List<String>> rows = new ArrayList<>();
        if (text == null || text.isEmpty()) return rows;

        String[] lines = text.replace("\r", "").split("\n", -1);
        for (String line : lines) {
            if (line.isBlank()) continue;
            rows.add(parseLine(line));
        }
        return rows;
    }

    static List<String> parseLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == QUOTE) {
                inQuotes = !inQuotes;
            } else if (ch == DELIMITER && !inQuotes) {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }
}
