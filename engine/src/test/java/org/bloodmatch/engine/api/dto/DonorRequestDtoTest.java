package org.bloodmatch.engine.api.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.model.DonorRegistration;
import org.junit.jupiter.api.Test;

class DonorRequestDtoTest {

    @Test
    void convertsCompleteRequest() throws Exception {
        DonorRequestDto dto = new ObjectMapper().readValue("{\"name\": \"Jane\", \"blood_group\": \"O+\","
                + " \"location\": \"Hospital B\", \"last_donation_date\": \"2025-02-15\", \"extra\": true}",
                DonorRequestDto.class);

        DonorRegistration registration = dto.toRegistration();

        assertThat(registration.getName()).isEqualTo("Jane");
        assertThat(registration.getBloodGroup()).isEqualTo("O+");
        assertThat(registration.getSite()).isEqualTo("Hospital B");
        assertThat(registration.getLastDonationDate()).isEqualTo("2025-02-15");
        assertThat(registration.getTotalDonations()).isZero();
    }

    @Test
    void reportsFirstMissingField() {
        assertThatThrownBy(() -> new DonorRequestDto(null, null, null, null).toRegistration())
                .hasFieldOrPropertyWithValue("code", ErrorCode.MISSING_FIELD)
                .hasMessage("Missing required field: name");
        assertThatThrownBy(() -> new DonorRequestDto("Jane", "O+", null, "2025-01-01").toRegistration())
                .hasMessage("Missing required field: location");
    }

    @Test
    void rejectsNegativeDonationCount() {
        DonorRequestDto dto = new DonorRequestDto("Jane", "O+", "Hospital B", "2025-01-01");
        dto.setTotalDonations(-3);

        assertThatThrownBy(dto::toRegistration)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_FIELD)
                .hasMessageContaining("total_donations");
    }

    @Test
    void keepsSuppliedDonationCount() {
        DonorRequestDto dto = new DonorRequestDto("Jane", "O+", "Hospital B", "2025-01-01");
        dto.setTotalDonations(4);

        assertThat(dto.toRegistration().getTotalDonations()).isEqualTo(4);
    }
}
