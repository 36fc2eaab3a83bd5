package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.BloodTypeStats;
import org.bloodmatch.engine.domain.model.MatchRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Append-only history of completed matches.
 */
public interface MatchLedger {

    void record(MatchRecord entry);

    /**
     * All entries, most recent first.
     */
    List<MatchRecord> query();

    int size();

    /**
     * Per blood type donor totals and currently eligible counts, in canonical
     * type order, computed from the live registry on every call.
     */
    List<BloodTypeStats> aggregateStats(LocalDate today);
}
