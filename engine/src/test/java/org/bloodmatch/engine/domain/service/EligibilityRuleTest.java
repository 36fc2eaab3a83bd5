package org.bloodmatch.engine.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.junit.jupiter.api.Test;

class EligibilityRuleTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 17);

    private final EligibilityRule rule = new EligibilityRule();

    @Test
    void ineligibleWithinCooldown() {
        assertThat(rule.isEligible(donorLastDonated(TODAY.minusDays(89)), TODAY)).isFalse();
        assertThat(rule.isEligible(donorLastDonated(TODAY), TODAY)).isFalse();
    }

    @Test
    void eligibleOnBoundaryDay() {
        assertThat(rule.isEligible(donorLastDonated(TODAY.minusDays(90)), TODAY)).isTrue();
    }

    @Test
    void eligibleAfterCooldown() {
        assertThat(rule.isEligible(donorLastDonated(TODAY.minusDays(100)), TODAY)).isTrue();
        assertThat(rule.isEligible(donorLastDonated(TODAY.minusYears(3)), TODAY)).isTrue();
    }

    @Test
    void missingDateIsNeverEligible() {
        assertThat(rule.isEligible(donorLastDonated(null), TODAY)).isFalse();
        assertThat(rule.isEligible(null, TODAY)).isFalse();
    }

    @Test
    void futureDonationDateIsNotEligible() {
        assertThat(rule.isEligible(donorLastDonated(TODAY.plusDays(5)), TODAY)).isFalse();
    }

    @Test
    void customCooldownIsHonoured() {
        EligibilityRule shortRule = new EligibilityRule(56);

        assertThat(shortRule.isEligible(donorLastDonated(TODAY.minusDays(56)), TODAY)).isTrue();
        assertThat(shortRule.isEligible(donorLastDonated(TODAY.minusDays(55)), TODAY)).isFalse();
        assertThat(shortRule.eligibleFrom(donorLastDonated(TODAY))).isEqualTo(TODAY.plusDays(56));
    }

    @Test
    void rejectsNonPositiveCooldown() {
        assertThatThrownBy(() -> new EligibilityRule(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Donor donorLastDonated(LocalDate date) {
        return new Donor.Builder()
                .id("d-1")
                .name("Test Donor")
                .bloodType(BloodType.O_NEGATIVE)
                .site("Hospital A")
                .lastDonationDate(date)
                .build();
    }
}
