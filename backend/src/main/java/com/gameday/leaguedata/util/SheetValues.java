package com.gameday.leaguedata.util;

import java.util.List;

/**
 * Lenient conversions for sheet cells. Blank and malformed numbers fall back to a default
 * instead of failing the row.
 */
public final class SheetValues {

    private SheetValues() {}

    /** Positional cell read; rows shorter than {@code index} yield an empty string. */
    public static String cell(List<String> row, int index) {
        if (row == null || index < 0 || index >= row.size()) return "";
        String v = row.get(index);
        return v == null ? "" : v;
    }

    public static String trim(String s) {
        return s == null ? "" : s.trim();
    }

    public static int toInt(String s) {
        Integer i = toIntOrNull(s);
        return i == null ? 0 : i;
    }

    public static double toDouble(String s) {
        Double d = toDoubleOrNull(s);
        return d == null ? 0.0 : d;
    }

    /** Null for blank, malformed, or values that round outside the int range. */
    public static Integer toIntOrNull(String s) {
        Double d = toDoubleOrNull(s);
        if (d == null) return null;
        long rounded = Math.round(d);
        if (rounded < Integer.MIN_VALUE || rounded > Integer.MAX_VALUE) return null;
        return (int) rounded;
    }

    public static Double toDoubleOrNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        if (t.isEmpty()) return null;
        try {
            double d = Double.parseDouble(t);
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return d;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
