package com.gameday.leaguedata.service;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * How a leaderboard orders its pool: a primary key with a direction, an optional
 * tie-break key (higher wins), an eligibility filter, the identity used to keep a
 * member out of more than one slot, and the placeholder for unfilled slots.
 */
public final class Ranking<T> {

    public enum Direction { HIGHER_IS_BETTER, LOWER_IS_BETTER }

    private final ToDoubleFunction<T> key;
    private final Direction direction;
    private final ToDoubleFunction<T> tieBreak;
    private final Predicate<T> eligibility;
    private final Function<T, String> identity;
    private final T sentinel;

    private Ranking(ToDoubleFunction<T> key, Direction direction, ToDoubleFunction<T> tieBreak,
                    Predicate<T> eligibility, Function<T, String> identity, T sentinel) {
        this.key = Objects.requireNonNull(key, "key");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.tieBreak = tieBreak;
        this.eligibility = eligibility == null ? t -> true : eligibility;
        this.identity = Objects.requireNonNull(identity, "identity");
        this.sentinel = sentinel;
    }

    public static <T> Ranking<T> by(ToDoubleFunction<T> key, Direction direction,
                                    Function<T, String> identity, T sentinel) {
        return new Ranking<>(key, direction, null, null, identity, sentinel);
    }

    public Ranking<T> thenBy(ToDoubleFunction<T> tieBreakKey) {
        return new Ranking<>(key, direction, tieBreakKey, eligibility, identity, sentinel);
    }

    public Ranking<T> onlyIf(Predicate<T> eligible) {
        return new Ranking<>(key, direction, tieBreak, eligible, identity, sentinel);
    }

    public T sentinel() {
        return sentinel;
    }

    boolean isEligible(T candidate) {
        return eligibility.test(candidate);
    }

    String identityOf(T candidate) {
        return identity.apply(candidate);
    }

    /**
     * True when {@code candidate} should take the slot from {@code holder}; a null holder is
     * an unfilled slot. For higher-is-better keys an unfilled slot is compared against the
     * sentinel's values, so zero-valued members never fill it. For lower-is-better keys any
     * eligible member fills it.
     */
    boolean beats(T candidate, T holder) {
        if (holder == null) {
            if (direction == Direction.LOWER_IS_BETTER) return true;
            holder = sentinel;
        }
        double c = key.applyAsDouble(candidate);
        double h = key.applyAsDouble(holder);
        boolean better = direction == Direction.HIGHER_IS_BETTER ? c > h : c < h;
        if (better) return true;
        if (c != h || tieBreak == null) return false;
        return tieBreak.applyAsDouble(candidate) > tieBreak.applyAsDouble(holder);
    }
}
