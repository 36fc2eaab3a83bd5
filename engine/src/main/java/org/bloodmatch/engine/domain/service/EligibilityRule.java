package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.Donor;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Post-donation cooldown rule.
 * A donor is eligible once at least {@code cooldownDays} whole days have
 * passed since the last donation; the boundary day itself is eligible.
 */
public final class EligibilityRule {

    public static final int DEFAULT_COOLDOWN_DAYS = 90;

    private final int cooldownDays;

    public EligibilityRule() {
        this(DEFAULT_COOLDOWN_DAYS);
    }

    public EligibilityRule(int cooldownDays) {
        if (cooldownDays < 1) {
            throw new IllegalArgumentException("cooldownDays must be at least 1");
        }
        this.cooldownDays = cooldownDays;
    }

    public int getCooldownDays() {
        return cooldownDays;
    }

    /**
     * Never throws: a donor without a usable donation date is not eligible.
     */
    public boolean isEligible(Donor donor, LocalDate today) {
        if (donor == null || today == null) {
            return false;
        }
        LocalDate last = donor.getLastDonationDate();
        if (last == null) {
            return false;
        }
        return ChronoUnit.DAYS.between(last, today) >= cooldownDays;
    }

    /**
     * First day on which the donor becomes eligible, or null if unknown.
     */
    public LocalDate eligibleFrom(Donor donor) {
        LocalDate last = donor.getLastDonationDate();
        return last == null ? null : last.plusDays(cooldownDays);
    }
}
