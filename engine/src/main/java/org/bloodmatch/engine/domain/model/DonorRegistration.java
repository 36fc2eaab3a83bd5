package org.bloodmatch.engine.domain.model;

import java.util.Objects;

/**
 * Unvalidated donor registration as submitted by a caller.
 * Blood group and last donation date are kept as raw text; the registry
 * normalizes and validates them.
 */
public final class DonorRegistration {

    private final String name;
    private final String bloodGroup;
    private final String site;
    private final String lastDonationDate;
    private final int totalDonations;

    public DonorRegistration(String name, String bloodGroup, String site, String lastDonationDate) {
        this(name, bloodGroup, site, lastDonationDate, 0);
    }

    public DonorRegistration(String name, String bloodGroup, String site, String lastDonationDate,
                             int totalDonations) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.bloodGroup = bloodGroup;
        this.site = site;
        this.lastDonationDate = lastDonationDate;
        this.totalDonations = totalDonations;
    }

    public String getName() {
        return name;
    }

    public String getBloodGroup() {
        return bloodGroup;
    }

    public String getSite() {
        return site;
    }

    public String getLastDonationDate() {
        return lastDonationDate;
    }

    public int getTotalDonations() {
        return totalDonations;
    }

    @Override
    public String toString() {
        return String.format("DonorRegistration{name=%s, bloodGroup=%s, site=%s, lastDonationDate=%s}",
                name, bloodGroup, site, lastDonationDate);
    }
}
