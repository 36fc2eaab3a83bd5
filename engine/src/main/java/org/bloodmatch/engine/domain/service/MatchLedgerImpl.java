package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.BloodTypeStats;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.MatchRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * In-memory match ledger backed by an append-only list.
 */
public final class MatchLedgerImpl implements MatchLedger {

    private static final Logger LOG = Logger.getLogger(MatchLedgerImpl.class.getName());

    private final DonorRegistry registry;
    private final List<MatchRecord> entries = new ArrayList<>();

    public MatchLedgerImpl(DonorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public void record(MatchRecord entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
        LOG.fine(() -> "Ledger entry #" + entries.size() + ": " + entry);
    }

    @Override
    public List<MatchRecord> query() {
        List<MatchRecord> newestFirst = new ArrayList<>(entries);
        Collections.reverse(newestFirst);
        return Collections.unmodifiableList(newestFirst);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<BloodTypeStats> aggregateStats(LocalDate today) {
        List<BloodTypeStats> stats = new ArrayList<>();
        for (BloodType type : BloodType.values()) {
            List<Donor> donors = registry.listByType(type);
            int eligible = 0;
            for (Donor donor : donors) {
                if (registry.isEligible(donor, today)) {
                    eligible++;
                }
            }
            stats.add(new BloodTypeStats(type, donors.size(), eligible));
        }
        return Collections.unmodifiableList(stats);
    }
}
