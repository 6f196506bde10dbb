package com.gameday.leaguedata.model;

/**
 * Canonical division a schedule label resolved to. Labels with no matching division
 * (exhibition games, byes) resolve to {@link #UNRESOLVED}.
 */
public record DivisionRef(String name, String abbreviation, String conference) {

    public static final DivisionRef UNRESOLVED = new DivisionRef("", "", "");

    public static DivisionRef of(Division d) {
        return new DivisionRef(d.division(), d.abbreviation(), d.conference());
    }

    public boolean isResolved() {
        return !abbreviation.isEmpty();
    }

    public String fullName() {
        return conference + " " + name;
    }
}
