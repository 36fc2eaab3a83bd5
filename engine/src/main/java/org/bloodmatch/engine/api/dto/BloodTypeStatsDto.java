package org.bloodmatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.bloodmatch.engine.domain.model.BloodTypeStats;

/**
 * DTO for the donor counts of one blood type.
 */
public final class BloodTypeStatsDto {

    @JsonProperty("total")
    private final int total;

    @JsonProperty("eligible")
    private final int eligible;

    private BloodTypeStatsDto(int total, int eligible) {
        this.total = total;
        this.eligible = eligible;
    }

    public static BloodTypeStatsDto from(BloodTypeStats stats) {
        return new BloodTypeStatsDto(stats.getTotal(), stats.getEligible());
    }

    public int getTotal() {
        return total;
    }

    public int getEligible() {
        return eligible;
    }
}
