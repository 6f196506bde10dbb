package com.gameday.leaguedata.service;

import com.gameday.leaguedata.model.Division;
import com.gameday.leaguedata.model.DivisionRef;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the free-text "{conference} {division}" labels used by the schedule and stat
 * sheets to a division row. A miss is not an error: callers get
 * {@link DivisionRef#UNRESOLVED} and fall back to their own placeholder.
 */
@Component
public class DivisionJoinResolver {

    public DivisionRef resolve(String label, List<Division> divisions) {
        return find(label, divisions)
                .map(DivisionRef::of)
                .orElse(DivisionRef.UNRESOLVED);
    }

    /** First division whose full name equals the label exactly. */
    public Optional<Division> find(String label, List<Division> divisions) {
        if (label == null || label.isEmpty() || divisions == null) return Optional.empty();
        for (Division d : divisions) {
            if (label.equals(d.fullName())) return Optional.of(d);
        }
        return Optional.empty();
    }
}
