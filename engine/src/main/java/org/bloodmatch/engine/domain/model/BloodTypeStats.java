package org.bloodmatch.engine.domain.model;

import java.util.Objects;

/**
 * Donor counts for a single blood type.
 */
public final class BloodTypeStats {

    private final BloodType bloodType;
    private final int total;
    private final int eligible;

    public BloodTypeStats(BloodType bloodType, int total, int eligible) {
        this.bloodType = Objects.requireNonNull(bloodType, "bloodType must not be null");
        this.total = total;
        this.eligible = eligible;
    }

    public BloodType getBloodType() {
        return bloodType;
    }

    public int getTotal() {
        return total;
    }

    public int getEligible() {
        return eligible;
    }

    @Override
    public String toString() {
        return bloodType + "{total=" + total + ", eligible=" + eligible + '}';
    }
}
