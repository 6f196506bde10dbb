package com.gameday.leaguedata.model;

import java.util.List;

/**
 * Divisions a run covers, resolved from the user's filter. {@code conference} is set when
 * the filter named a single division or conference.
 */
public record DivisionSelection(String filter, Scope scope, String conference, List<Division> divisions) {

    public enum Scope { ALL, CONFERENCE, DIVISION, NONE }

    public boolean isEmpty() {
        return divisions.isEmpty();
    }
}
