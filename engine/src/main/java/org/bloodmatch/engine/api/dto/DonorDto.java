package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.model.Donor;

/**
 * DTO for a registered donor.
 */
public final class DonorDto {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("blood_group")
    private final String bloodGroup;

    @JsonProperty("location")
    private final String location;

    // null when the registered date was missing or unparsable
    @JsonProperty("last_donation_date")
    private final String lastDonationDate;

    @JsonProperty("total_donations")
    private final int totalDonations;

    @JsonProperty("eligible")
    private final boolean eligible;

    private DonorDto(Donor donor, boolean eligible) {
        this.id = donor.getId();
        this.name = donor.getName();
        this.bloodGroup = donor.getBloodType().getLabel();
        this.location = donor.getSite();
        this.lastDonationDate = donor.getLastDonationDate() == null ? null : donor.getLastDonationDate().toString();
        this.totalDonations = donor.getTotalDonations();
        this.eligible = eligible;
    }

    public static DonorDto from(Donor donor, boolean eligible) {
        return new DonorDto(donor, eligible);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getBloodGroup() {
        return bloodGroup;
    }

    public String getLocation() {
        return location;
    }

    public String getLastDonationDate() {
        return lastDonationDate;
    }

    public int getTotalDonations() {
        return totalDonations;
    }

    public boolean isEligible() {
        return eligible;
    }
}
