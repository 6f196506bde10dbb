package com.gameday.leaguedata.dto;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Game;

import java.util.List;

/** Games of one conference on one date and of one game type, split into template pages. */
public record ScheduleBoardDTO(Conference conference,
                               String date,
                               String dateShort,
                               String gameTypeLabel,
                               String season,
                               DocType docType,
                               int week,
                               List<List<Game>> chunks) {

    public enum DocType { FINAL_SCORES, UPCOMING }
}
