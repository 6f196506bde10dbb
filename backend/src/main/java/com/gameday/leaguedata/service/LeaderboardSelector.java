package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.GoalieStatLine;
import com.gameday.leaguedata.model.PlayerStatLine;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed-size leaderboards over a stat pool.
 * <p>
 * Each slot is filled independently by scanning the whole pool for the best member not
 * already placed in an earlier slot (matched by full name). Ties on the primary key go
 * to the tie-break key when the ranking has one, otherwise to the member seen first.
 * Slots nobody qualifies for hold the ranking's sentinel, always after the filled ones.
 */
@Component
public class LeaderboardSelector {

    /** Goalies need at least this share of the pool's most games played to rank on GAA. */
    static final int GAA_MIN_GP_PERCENT = 44;

    public <T> List<T> topN(Collection<T> pool, int n, Ranking<T> ranking) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        List<T> slots = new ArrayList<>(n);
        Set<String> placed = new HashSet<>();

        for (int m = 0; m < n; m++) {
            T holder = null;
            if (pool != null) {
                for (T candidate : pool) {
                    if (candidate == null || !ranking.isEligible(candidate)) continue;
                    if (placed.contains(ranking.identityOf(candidate))) continue;
                    if (ranking.beats(candidate, holder)) holder = candidate;
                }
            }
            if (holder == null) {
                slots.add(ranking.sentinel());
            } else {
                slots.add(holder);
                placed.add(ranking.identityOf(holder));
            }
        }
        return slots;
    }

    public List<PlayerStatLine> topPoints(Collection<PlayerStatLine> pool, int n) {
        return topN(pool, n, pointsRanking());
    }

    public List<PlayerStatLine> topGoals(Collection<PlayerStatLine> pool, int n) {
        return topN(pool, n, goalsRanking());
    }

    public List<PlayerStatLine> topPointsPerGame(Collection<PlayerStatLine> pool, int n) {
        return topN(pool, n, pointsPerGameRanking());
    }

    public List<GoalieStatLine> topGoalsAgainstAverage(Collection<GoalieStatLine> pool, int n) {
        return topN(pool, n, goalsAgainstAverageRanking(minGamesForGaa(pool)));
    }

    /** Points, ties going to the player with more goals. */
    public static Ranking<PlayerStatLine> pointsRanking() {
        return Ranking.by((PlayerStatLine p) -> p.points(), Ranking.Direction.HIGHER_IS_BETTER,
                        PlayerStatLine::fullName, PlayerStatLine.EMPTY)
                .thenBy(PlayerStatLine::goals);
    }

    public static Ranking<PlayerStatLine> goalsRanking() {
        return Ranking.by((PlayerStatLine p) -> p.goals(), Ranking.Direction.HIGHER_IS_BETTER,
                PlayerStatLine::fullName, PlayerStatLine.EMPTY);
    }

    public static Ranking<PlayerStatLine> pointsPerGameRanking() {
        return Ranking.by(PlayerStatLine::pointsPerGame, Ranking.Direction.HIGHER_IS_BETTER,
                PlayerStatLine::fullName, PlayerStatLine.EMPTY);
    }

    public static Ranking<GoalieStatLine> goalsAgainstAverageRanking(int minGamesPlayed) {
        return Ranking.by(GoalieStatLine::goalsAgainstAverage, Ranking.Direction.LOWER_IS_BETTER,
                        GoalieStatLine::fullName, GoalieStatLine.EMPTY)
                .onlyIf(g -> g.gamesPlayed() >= minGamesPlayed);
    }

    /** ceil(0.44 * most games played in the pool), in integer arithmetic. */
    public static int minGamesForGaa(Collection<GoalieStatLine> pool) {
        int maxGp = 0;
        if (pool != null) {
            for (GoalieStatLine g : pool) {
                if (g != null && g.gamesPlayed() > maxGp) maxGp = g.gamesPlayed();
            }
        }
        return (GAA_MIN_GP_PERCENT * maxGp + 99) / 100;
    }
}
