package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.Conference;
import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionRef;
import com.gameday.leaguedata.model.DivisionSelection;
import com.gameday.leaguedata.model.Game;
import com.gameday.leaguedata.model.GameType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DivisionSelectorTest {

    private final DivisionSelector selector = new DivisionSelector();

    private final Division en = new Division("East", "North", "EN", "", "", "N");
    private final Division es = new Division("East", "South", "ES", "", "", "S");
    private final Division wc = new Division("West", "Coast", "WC", "", "", "C");
    private final List<Division> divisions = List.of(en, es, wc);
    private final List<Conference> conferences = List.of(
            new Conference("East", "#1", "ET", "Boston"), new Conference("West", "#2", "PT", "Seattle"));

    private static Game game(int week, GameType type, Division d) {
        return new Game(week, type, type == GameType.PLAYOFF ? "Playoffs" : "Regular Season", "", "", "", "", "",
                "A", DivisionRef.of(d), "", "B", DivisionRef.of(d), "", "", "", "", "", "");
    }

    @Test
    void blankOrAllSelectsEverything() {
        assertThat(selector.select(null, divisions, conferences).scope()).isEqualTo(DivisionSelection.Scope.ALL);
        assertThat(selector.select(" all ", divisions, conferences).divisions()).hasSize(3);
    }

    @Test
    void abbreviationOrFullLabelSelectsOneDivision() {
        DivisionSelection byAbb = selector.select("es", divisions, conferences);
        assertThat(byAbb.scope()).isEqualTo(DivisionSelection.Scope.DIVISION);
        assertThat(byAbb.divisions()).containsExactly(es);

        assertThat(selector.select("East North", divisions, conferences).divisions()).containsExactly(en);
    }

    @Test
    void conferenceNameSelectsItsDivisions() {
        DivisionSelection east = selector.select("EAST", divisions, conferences);
        assertThat(east.scope()).isEqualTo(DivisionSelection.Scope.CONFERENCE);
        assertThat(east.conference()).isEqualTo("East");
        assertThat(east.divisions()).containsExactly(en, es);
    }

    @Test
    void unknownFilterSelectsNothing() {
        DivisionSelection none = selector.select("Mystery", divisions, conferences);
        assertThat(none.scope()).isEqualTo(DivisionSelection.Scope.NONE);
        assertThat(none.isEmpty()).isTrue();
    }

    @Test
    void activeDivisionsHaveAGameThisWeekOrNext() {
        List<Game> games = List.of(game(4, GameType.REGULAR_SEASON, en), game(6, GameType.PLAYOFF, es),
                game(8, GameType.REGULAR_SEASON, wc));
        DivisionSelection all = selector.select("", divisions, conferences);

        assertThat(selector.activeDivisions(all, games, 5, false)).containsExactly(es);
        assertThat(selector.activeDivisions(all, games, 4, false)).containsExactly(en);
        assertThat(selector.activeDivisions(all, games, 5, false, GameType.REGULAR_SEASON)).isEmpty();
        assertThat(selector.activeDivisions(all, games, 5, true)).containsExactly(en, es, wc);
    }
}
