package com.gameday.leaguedata.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderIndexTest {

    @Test
    void looksCellsUpByColumnName() {
        HeaderIndex h = HeaderIndex.of(List.of("Team", "GP", "PTS"));
        List<String> row = List.of("Rockets", "10", "14");
        assertThat(h.get(row, "PTS")).isEqualTo("14");
        assertThat(h.has("GP")).isTrue();
        assertThat(h.size()).isEqualTo(3);
    }

    @Test
    void missingColumnOrShortRowReadsAsEmpty() {
        HeaderIndex h = HeaderIndex.of(List.of("Team", "GP", "PTS"));
        assertThat(h.get(List.of("Rockets"), "PTS")).isEmpty();
        assertThat(h.get(List.of("Rockets", "1", "2"), "RANK")).isEmpty();
        assertThat(h.get(null, "Team")).isEmpty();
    }

    @Test
    void laterDuplicateColumnWins() {
        HeaderIndex h = HeaderIndex.of(List.of("Score", "Team", "Score"));
        assertThat(h.get(List.of("1", "A", "2"), "Score")).isEqualTo("2");
        assertThat(h.size()).isEqualTo(2);
    }

    @Test
    void headerRowBeyondSheetGivesEmptyIndex() {
        HeaderIndex h = HeaderIndex.of(List.of(List.of("meta")), 2);
        assertThat(h.size()).isZero();
        assertThat(h.get(List.of("x"), "Week")).isEmpty();
    }
}
