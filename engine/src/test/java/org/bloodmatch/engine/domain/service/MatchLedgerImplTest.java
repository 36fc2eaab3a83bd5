package org.bloodmatch.engine.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bloodmatch.engine.TestGraphs.A;
import static org.bloodmatch.engine.TestGraphs.B;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.bloodmatch.engine.TestGraphs;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.BloodTypeStats;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.DonorRegistration;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatchLedgerImplTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 17);

    private DonorRegistryImpl registry;
    private MatchLedgerImpl ledger;

    @BeforeEach
    void setUp() {
        registry = new DonorRegistryImpl(TestGraphs.hospitals(), new EligibilityRule());
        ledger = new MatchLedgerImpl(registry);
    }

    @Test
    void returnsEntriesNewestFirst() {
        Donor donor = registry.register(new DonorRegistration("Jane", "O-", A, "2025-01-01"));
        PatientQuery patient = new PatientQuery(BloodType.A_POSITIVE, B);
        MatchRecord first = MatchRecord.normal(Instant.parse("2026-01-01T00:00:00Z"), patient, donor, 15.0);
        MatchRecord second = MatchRecord.emergency(Instant.parse("2026-01-02T00:00:00Z"), 1, patient, donor, 15.0);

        ledger.record(first);
        ledger.record(second);

        assertThat(ledger.query()).containsExactly(second, first);
        assertThat(ledger.size()).isEqualTo(2);
    }

    @Test
    void queryIsADetachedCopy() {
        Donor donor = registry.register(new DonorRegistration("Jane", "O-", A, "2025-01-01"));
        ledger.record(MatchRecord.normal(Instant.EPOCH, new PatientQuery(BloodType.O_NEGATIVE, A), donor, 0.0));

        List<MatchRecord> view = ledger.query();
        ledger.record(MatchRecord.normal(Instant.EPOCH, new PatientQuery(BloodType.O_NEGATIVE, A), donor, 0.0));

        assertThat(view).hasSize(1);
        assertThatThrownBy(view::clear).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void recordKeepsDonorStateAtMatchTime() {
        Donor donor = registry.register(new DonorRegistration("Jane", "O-", A, "2025-01-01"));
        MatchRecord record = MatchRecord.normal(Instant.EPOCH, new PatientQuery(BloodType.O_NEGATIVE, A), donor, 0.0);

        registry.markDonated(donor, TODAY);

        assertThat(record.getDonor().getTotalDonations()).isZero();
        assertThat(donor.getTotalDonations()).isEqualTo(1);
    }

    @Test
    void statsCoverEveryTypeInCanonicalOrder() {
        registry.register(new DonorRegistration("Eligible", "O-", A, "2025-01-01"));
        registry.register(new DonorRegistration("Resting", "O-", B, TODAY.minusDays(3).toString()));
        registry.register(new DonorRegistration("Unknown date", "AB+", B, "not a date"));

        List<BloodTypeStats> stats = ledger.aggregateStats(TODAY);

        assertThat(stats).extracting(BloodTypeStats::getBloodType).containsExactly(BloodType.values());
        assertThat(stats.get(0).getTotal()).isEqualTo(2);
        assertThat(stats.get(0).getEligible()).isEqualTo(1);
        assertThat(stats.get(7).getTotal()).isEqualTo(1);
        assertThat(stats.get(7).getEligible()).isZero();
        assertThat(stats).allMatch(s -> s.getEligible() <= s.getTotal());
        assertThat(stats.stream().mapToInt(BloodTypeStats::getTotal).sum()).isEqualTo(registry.size());
    }

    @Test
    void statsReflectLaterDonations() {
        Donor donor = registry.register(new DonorRegistration("Eligible", "B+", A, "2025-01-01"));
        assertThat(ledger.aggregateStats(TODAY).get(5).getEligible()).isEqualTo(1);

        registry.markDonated(donor, TODAY);

        assertThat(ledger.aggregateStats(TODAY).get(5).getEligible()).isZero();
    }
}
