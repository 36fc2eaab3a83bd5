package org.bloodmatch.engine.seed;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.bloodmatch.engine.MutableClock;
import org.bloodmatch.engine.TestGraphs;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.service.EligibilityRule;
import org.bloodmatch.engine.engine.BloodMatchEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SampleDonorSeederTest {

    private BloodMatchEngine engine;
    private SampleDonorSeeder seeder;

    @BeforeEach
    void setUp() {
        engine = BloodMatchEngine.create(TestGraphs.hospitals(), new EligibilityRule(),
                new MutableClock(Instant.parse("2026-01-17T10:00:00Z")));
        seeder = new SampleDonorSeeder(engine);
    }

    @Test
    void seedsBundledDonors() throws IOException {
        int count = seeder.seedDefaults();

        assertThat(count).isEqualTo(8);
        assertThat(engine.listDonors())
                .extracting(Donor::getName)
                .startsWith("John Doe", "Jane Smith")
                .endsWith("Frank Wilson");
        assertThat(engine.listDonors()).allMatch(engine::isEligible);
    }

    @Test
    void skipsInvalidEntries() throws IOException {
        String json = "[{\"name\": \"Good\", \"blood_group\": \"A+\", \"location\": \"Hospital A\","
                + " \"last_donation_date\": \"2025-01-01\"},"
                + " {\"name\": \"Bad type\", \"blood_group\": \"K+\", \"location\": \"Hospital A\","
                + " \"last_donation_date\": \"2025-01-01\"},"
                + " {\"name\": \"No site\", \"blood_group\": \"A+\", \"last_donation_date\": \"2025-01-01\"}]";

        int count = seeder.seed(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(count).isEqualTo(1);
        assertThat(engine.listDonors()).extracting(Donor::getName).containsExactly("Good");
    }
}
