package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.EmergencyTicket;

/**
 * DTO for an emergency request submission.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EmergencyRequestDto {

    // kept as a raw node so that a non-integer value can be reported as an invalid urgency
    @JsonProperty("urgency_level")
    private JsonNode urgencyLevel;

    @JsonProperty("patient")
    private PatientDto patient;

    public EmergencyRequestDto() {
    }

    public EmergencyRequestDto(int urgencyLevel, PatientDto patient) {
        this.urgencyLevel = IntNode.valueOf(urgencyLevel);
        this.patient = patient;
    }

    /**
     * Urgency as an integer; absent means most urgent.
     *
     * @throws MatchingException with INVALID_URGENCY for a non-integer value
     */
    public int resolveUrgency() {
        if (urgencyLevel == null || urgencyLevel.isNull()) {
            return EmergencyTicket.MOST_URGENT;
        }
        if (!urgencyLevel.isIntegralNumber() || !urgencyLevel.canConvertToInt()) {
            throw MatchingException.invalidUrgency(urgencyLevel);
        }
        return urgencyLevel.intValue();
    }

    /**
     * @throws MatchingException with MISSING_FIELD when the patient or one of its fields is absent
     */
    public PatientDto requirePatient() {
        if (patient == null) {
            throw MatchingException.missingField("patient");
        }
        if (isBlank(patient.getBloodGroup())) {
            throw MatchingException.missingField("patient.blood_group");
        }
        if (isBlank(patient.getLocation())) {
            throw MatchingException.missingField("patient.location");
        }
        return patient;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public JsonNode getUrgencyLevel() {
        return urgencyLevel;
    }

    public void setUrgencyLevel(JsonNode urgencyLevel) {
        this.urgencyLevel = urgencyLevel;
    }

    public PatientDto getPatient() {
        return patient;
    }

    public void setPatient(PatientDto patient) {
        this.patient = patient;
    }
}
