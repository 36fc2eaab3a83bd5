package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.PatientQuery;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Nearest-eligible-donor matching.
 *
 * Candidates are the donors of every compatible type. Ineligible donors and
 * donors at unreachable sites are dropped; the remaining candidate with the
 * shortest graph distance wins, ties going to the earliest registration.
 * The chosen donor is marked donated and the match appended to the ledger
 * in the same call. Not thread-safe; callers serialize access.
 */
public final class MatchingServiceImpl implements MatchingService {

    private static final Logger LOG = Logger.getLogger(MatchingServiceImpl.class.getName());

    private final DonorRegistry registry;
    private final DistanceGraph graph;
    private final MatchLedger ledger;
    private final ZoneId zone;

    public MatchingServiceImpl(DonorRegistry registry, DistanceGraph graph, MatchLedger ledger, ZoneId zone) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    @Override
    public PatientQuery resolvePatient(String bloodGroup, String site) {
        BloodType type = BloodType.parse(bloodGroup);
        String trimmed = site == null ? null : site.trim();
        if (!graph.containsSite(trimmed)) {
            throw MatchingException.invalidSite(site);
        }
        return new PatientQuery(type, trimmed);
    }

    @Override
    public MatchRecord findBestDonor(PatientQuery patient, Instant now) {
        Candidate best = selectDonor(patient, now);
        commit(best, now);
        MatchRecord record = MatchRecord.normal(now, patient, best.donor, best.distance);
        ledger.record(record);
        LOG.info(() -> String.format("Matched %s with donor %s (%s at %s, %.1f km)",
                patient, best.donor.getName(), best.donor.getBloodType(), best.donor.getSite(), best.distance));
        return record;
    }

    @Override
    public MatchRecord findBestDonor(EmergencyTicket ticket, Instant now) {
        PatientQuery patient = ticket.getPatient();
        Candidate best = selectDonor(patient, now);
        commit(best, now);
        MatchRecord record = MatchRecord.emergency(now, ticket.getUrgency(), patient, best.donor, best.distance);
        ledger.record(record);
        LOG.info(() -> String.format("Emergency %s (urgency %d) matched with donor %s (%s at %s, %.1f km)",
                ticket.getId(), ticket.getUrgency(), best.donor.getName(), best.donor.getBloodType(),
                best.donor.getSite(), best.distance));
        return record;
    }

    /**
     * Pure selection step; leaves all state untouched.
     */
    private Candidate selectDonor(PatientQuery patient, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, zone);
        List<BloodType> compatible = BloodTypeCompatibility.compatibleDonorTypes(patient.getBloodType());

        int compatibleCount = 0;
        int eligibleCount = 0;
        Candidate best = null;

        for (BloodType type : compatible) {
            for (Donor donor : registry.listByType(type)) {
                compatibleCount++;
                if (!registry.isEligible(donor, today)) {
                    continue;
                }
                eligibleCount++;
                double distance = graph.shortestDistance(patient.getSite(), donor.getSite());
                if (!DistanceGraph.isReachable(distance)) {
                    LOG.warning(() -> String.format("Donor %s at %s is unreachable from %s",
                            donor.getId(), donor.getSite(), patient.getSite()));
                    continue;
                }
                LOG.fine(() -> String.format("Candidate %s (%s) at %.1f km", donor.getName(), type, distance));
                if (best == null || isBetter(distance, donor, best)) {
                    best = new Candidate(donor, distance);
                }
            }
        }

        if (compatibleCount == 0) {
            throw new MatchingException(ErrorCode.NO_COMPATIBLE_DONORS,
                    "No compatible donors registered for blood group " + patient.getBloodType());
        }
        if (best == null) {
            String detail = eligibleCount == 0
                    ? "No eligible donor found"
                    : "No eligible donor reachable from " + patient.getSite();
            throw new MatchingException(ErrorCode.NO_ELIGIBLE_DONORS, detail);
        }
        return best;
    }

    private static boolean isBetter(double distance, Donor donor, Candidate current) {
        int cmp = Double.compare(distance, current.distance);
        if (cmp != 0) {
            return cmp < 0;
        }
        return donor.getRegistrationOrder() < current.donor.getRegistrationOrder();
    }

    private void commit(Candidate chosen, Instant now) {
        registry.markDonated(chosen.donor, LocalDate.ofInstant(now, zone));
    }

    private static final class Candidate {
        private final Donor donor;
        private final double distance;

        Candidate(Donor donor, double distance) {
            this.donor = donor;
            this.distance = distance;
        }
    }
}
