package org.bloodmatch.engine.domain.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * A queued emergency request.
 * Ordered by urgency (1 = most urgent) and then by arrival sequence.
 */
public final class EmergencyTicket {

    public static final int MOST_URGENT = 1;
    public static final int LEAST_URGENT = 5;

    /**
     * Admission order: urgency ascending, then sequence ascending.
     */
    public static final Comparator<EmergencyTicket> PRIORITY_ORDER =
            Comparator.comparingInt(EmergencyTicket::getUrgency)
                    .thenComparingLong(EmergencyTicket::getSequence);

    private final String id;
    private final int urgency;
    private final long sequence;
    private final PatientQuery patient;
    private final Instant submittedAt;

    public EmergencyTicket(String id, int urgency, long sequence, PatientQuery patient, Instant submittedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.urgency = urgency;
        this.sequence = sequence;
        this.patient = Objects.requireNonNull(patient, "patient must not be null");
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    }

    public static boolean isValidUrgency(int urgency) {
        return urgency >= MOST_URGENT && urgency <= LEAST_URGENT;
    }

    public String getId() {
        return id;
    }

    public int getUrgency() {
        return urgency;
    }

    public long getSequence() {
        return sequence;
    }

    public PatientQuery getPatient() {
        return patient;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    @Override
    public String toString() {
        return String.format("EmergencyTicket{id=%s, urgency=%d, seq=%d, patient=%s}",
                id, urgency, sequence, patient);
    }
}
