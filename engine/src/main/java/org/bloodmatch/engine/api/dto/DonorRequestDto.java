package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.DonorRegistration;

/**
 * DTO for a donor registration request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DonorRequestDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("blood_group")
    private String bloodGroup;

    @JsonProperty("location")
    private String location;

    @JsonProperty("last_donation_date")
    private String lastDonationDate;

    @JsonProperty("total_donations")
    private Integer totalDonations;

    public DonorRequestDto() {
    }

    public DonorRequestDto(String name, String bloodGroup, String location, String lastDonationDate) {
        this.name = name;
        this.bloodGroup = bloodGroup;
        this.location = location;
        this.lastDonationDate = lastDonationDate;
    }

    /**
     * Convert to a domain registration after checking that every required field is present.
     *
     * @throws MatchingException with MISSING_FIELD naming the first absent field,
     *         or INVALID_FIELD for a negative donation count
     */
    public DonorRegistration toRegistration() {
        requirePresent("name", name);
        requirePresent("blood_group", bloodGroup);
        requirePresent("location", location);
        requirePresent("last_donation_date", lastDonationDate);
        int total = totalDonations == null ? 0 : totalDonations;
        if (total < 0) {
            throw MatchingException.invalidField("total_donations", "must not be negative");
        }
        return new DonorRegistration(name, bloodGroup, location, lastDonationDate, total);
    }

    private static void requirePresent(String field, String value) {
        if (value == null) {
            throw MatchingException.missingField(field);
        }
    }

    // Getters and Setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getBloodGroup() {
        return bloodGroup;
    }

    public void setBloodGroup(String bloodGroup) {
        this.bloodGroup = bloodGroup;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getLastDonationDate() {
        return lastDonationDate;
    }

    public void setLastDonationDate(String lastDonationDate) {
        this.lastDonationDate = lastDonationDate;
    }

    public Integer getTotalDonations() {
        return totalDonations;
    }

    public void setTotalDonations(Integer totalDonations) {
        this.totalDonations = totalDonations;
    }
}
