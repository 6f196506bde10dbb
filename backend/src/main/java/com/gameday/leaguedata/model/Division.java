package com.gameday.leaguedata.model;

public record Division(String conference,
                       String division,
                       String abbreviation,
                       String color1,
                       String color2,
                       String shortLabel) {

    /** The "{conference} {division}" label other sheets use to refer to this division. */
    public String fullName() {
        return conference + " " + division;
    }
}
