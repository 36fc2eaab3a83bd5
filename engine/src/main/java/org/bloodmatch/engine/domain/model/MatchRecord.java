package org.bloodmatch.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a completed donor match.
 */
public final class MatchRecord {

    private final Instant timestamp;
    private final MatchKind kind;
    private final Integer urgency;
    private final PatientQuery patient;
    private final Donor donor;
    private final double distanceKm;

    private MatchRecord(Instant timestamp, MatchKind kind, Integer urgency, PatientQuery patient,
                        Donor donor, double distanceKm) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.urgency = urgency;
        this.patient = Objects.requireNonNull(patient, "patient must not be null");
        this.donor = Objects.requireNonNull(donor, "donor must not be null").snapshot();
        this.distanceKm = distanceKm;
    }

    public static MatchRecord normal(Instant timestamp, PatientQuery patient, Donor donor, double distanceKm) {
        return new MatchRecord(timestamp, MatchKind.NORMAL, null, patient, donor, distanceKm);
    }

    public static MatchRecord emergency(Instant timestamp, int urgency, PatientQuery patient, Donor donor,
                                        double distanceKm) {
        return new MatchRecord(timestamp, MatchKind.EMERGENCY, urgency, patient, donor, distanceKm);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MatchKind getKind() {
        return kind;
    }

    /**
     * Urgency of the emergency ticket, or null for a normal match.
     */
    public Integer getUrgency() {
        return urgency;
    }

    public PatientQuery getPatient() {
        return patient;
    }

    /**
     * The donor as it stood right after the match.
     */
    public Donor getDonor() {
        return donor.snapshot();
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    @Override
    public String toString() {
        return String.format("MatchRecord{%s, kind=%s, patient=%s, donor=%s, distance=%.1fkm}",
                timestamp, kind, patient, donor.getId(), distanceKm);
    }
}
