package com.gameday.leaguedata.model;

/** Team branding row. {@code fullName} is the key every other sheet joins on. */
public record Team(String conference,
                   String division,
                   String abbreviation,
                   String city,
                   String name,
                   String fullName,
                   String color1,
                   String color2) {
}
