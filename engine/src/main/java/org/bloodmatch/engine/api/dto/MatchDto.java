package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.MatchRecord;

import java.time.Instant;

/**
 * DTO for a completed match as shown in the matching history.
 */
public final class MatchDto {

    static final String NOT_APPLICABLE = "N/A";

    @JsonProperty("match_id")
    private final long matchId;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    @JsonProperty("match_type")
    private final String matchType;

    // integer for emergencies, "N/A" for normal matches
    @JsonProperty("urgency_level")
    private final Object urgencyLevel;

    @JsonProperty("patient")
    private final PatientDto patient;

    @JsonProperty("donor")
    private final MatchedDonorDto donor;

    @JsonProperty("distance_km")
    private final double distanceKm;

    private MatchDto(long matchId, MatchRecord record) {
        this.matchId = matchId;
        this.timestamp = record.getTimestamp();
        this.matchType = record.getKind().getLabel();
        this.urgencyLevel = record.getUrgency() == null ? NOT_APPLICABLE : record.getUrgency();
        this.patient = PatientDto.from(record.getPatient());
        this.donor = new MatchedDonorDto(record.getDonor());
        this.distanceKm = record.getDistanceKm();
    }

    /**
     * @param matchId 1-based position of the record in the ledger
     */
    public static MatchDto from(long matchId, MatchRecord record) {
        return new MatchDto(matchId, record);
    }

    public long getMatchId() {
        return matchId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMatchType() {
        return matchType;
    }

    public Object getUrgencyLevel() {
        return urgencyLevel;
    }

    public PatientDto getPatient() {
        return patient;
    }

    public MatchedDonorDto getDonor() {
        return donor;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    /**
     * Donor summary embedded in a match.
     */
    public static final class MatchedDonorDto {

        @JsonProperty("id")
        private final String id;

        @JsonProperty("name")
        private final String name;

        @JsonProperty("blood_group")
        private final String bloodGroup;

        @JsonProperty("location")
        private final String location;

        MatchedDonorDto(Donor donor) {
            this.id = donor.getId();
            this.name = donor.getName();
            this.bloodGroup = donor.getBloodType().getLabel();
            this.location = donor.getSite();
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
    }
}
