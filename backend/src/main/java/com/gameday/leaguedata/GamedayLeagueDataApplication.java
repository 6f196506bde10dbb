package com.gameday.leaguedata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GamedayLeagueDataApplication {
    public static void main(String[] args) {
        SpringApplication.run(GamedayLeagueDataApplication.class, args);
    }
}
