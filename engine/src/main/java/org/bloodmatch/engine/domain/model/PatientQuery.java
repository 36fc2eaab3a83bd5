package org.bloodmatch.engine.domain.model;

import java.util.Objects;

/**
 * A validated patient request: the patient's blood type and site.
 */
public final class PatientQuery {

    private final BloodType bloodType;
    private final String site;

    public PatientQuery(BloodType bloodType, String site) {
        this.bloodType = Objects.requireNonNull(bloodType, "bloodType must not be null");
        this.site = Objects.requireNonNull(site, "site must not be null");
    }

    public BloodType getBloodType() {
        return bloodType;
    }

    public String getSite() {
        return site;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PatientQuery)) {
            return false;
        }
        PatientQuery other = (PatientQuery) o;
        return bloodType == other.bloodType && site.equals(other.site);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bloodType, site);
    }

    @Override
    public String toString() {
        return bloodType + "@" + site;
    }
}
