package com.gameday.leaguedata.model;

public record Conference(String name, String color, String timeZone, String location) {
}
