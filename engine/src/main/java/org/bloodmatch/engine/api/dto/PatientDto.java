package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.model.PatientQuery;

/**
 * DTO for a patient's blood group and location.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PatientDto {

    @JsonProperty("blood_group")
    private String bloodGroup;

    @JsonProperty("location")
    private String location;

    public PatientDto() {
    }

    public PatientDto(String bloodGroup, String location) {
        this.bloodGroup = bloodGroup;
        this.location = location;
    }

    public static PatientDto from(PatientQuery patient) {
        return new PatientDto(patient.getBloodType().getLabel(), patient.getSite());
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
}
