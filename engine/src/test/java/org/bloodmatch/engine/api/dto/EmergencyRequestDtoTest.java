package org.bloodmatch.engine.api.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.junit.jupiter.api.Test;

class EmergencyRequestDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void urgencyDefaultsToMostUrgent() throws Exception {
        EmergencyRequestDto dto = mapper.readValue(
                "{\"patient\": {\"blood_group\": \"O+\", \"location\": \"Hospital A\"}}", EmergencyRequestDto.class);

        assertThat(dto.resolveUrgency()).isEqualTo(1);
        assertThat(dto.requirePatient().getBloodGroup()).isEqualTo("O+");
    }

    @Test
    void readsIntegralUrgency() throws Exception {
        EmergencyRequestDto dto = mapper.readValue(
                "{\"urgency_level\": 4, \"patient\": {\"blood_group\": \"O+\", \"location\": \"Hospital A\"}}",
                EmergencyRequestDto.class);

        assertThat(dto.resolveUrgency()).isEqualTo(4);
    }

    @Test
    void nonIntegralUrgencyIsInvalid() throws Exception {
        EmergencyRequestDto text = mapper.readValue("{\"urgency_level\": \"high\"}", EmergencyRequestDto.class);
        EmergencyRequestDto fraction = mapper.readValue("{\"urgency_level\": 2.5}", EmergencyRequestDto.class);

        assertThatThrownBy(text::resolveUrgency).hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_URGENCY);
        assertThatThrownBy(fraction::resolveUrgency).hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_URGENCY);
    }

    @Test
    void namesTheMissingPatientField() {
        assertThatThrownBy(() -> new EmergencyRequestDto(1, null).requirePatient())
                .hasMessage("Missing required field: patient");
        assertThatThrownBy(() -> new EmergencyRequestDto(1, new PatientDto(null, "Hospital A")).requirePatient())
                .hasMessage("Missing required field: patient.blood_group");
        assertThatThrownBy(() -> new EmergencyRequestDto(1, new PatientDto("O+", " ")).requirePatient())
                .hasMessage("Missing required field: patient.location");
    }
}
