package org.bloodmatch.engine.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.bloodmatch.engine.TestGraphs.A;
import static org.bloodmatch.engine.TestGraphs.B;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import org.bloodmatch.engine.TestGraphs;
import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodType;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.DonorRegistration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DonorRegistryImplTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 17);

    private DonorRegistryImpl registry;

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        registry = new DonorRegistryImpl(TestGraphs.hospitals(), new EligibilityRule(),
                () -> "donor-" + ids.incrementAndGet());
    }

    @Test
    void registersNormalizedDonor() {
        Donor donor = registry.register(new DonorRegistration("Jane", " o+ ", " Hospital B ", "2025-06-01", 3));

        assertThat(donor.getId()).isEqualTo("donor-1");
        assertThat(donor.getBloodType()).isEqualTo(BloodType.O_POSITIVE);
        assertThat(donor.getSite()).isEqualTo(B);
        assertThat(donor.getLastDonationDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(donor.getTotalDonations()).isEqualTo(3);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void indexesByTypeInRegistrationOrder() {
        registry.register(new DonorRegistration("First", "A+", A, "2025-01-01"));
        registry.register(new DonorRegistration("Other", "B+", A, "2025-01-01"));
        registry.register(new DonorRegistration("Second", "A%2B", B, "2025-01-01"));

        assertThat(registry.listByType(BloodType.A_POSITIVE))
                .extracting(Donor::getName)
                .containsExactly("First", "Second");
        assertThat(registry.listByType(BloodType.AB_NEGATIVE)).isEmpty();
        assertThat(registry.listAll())
                .extracting(Donor::getRegistrationOrder)
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void rejectsInvalidBloodGroupWithoutStoringAnything() {
        assertThatThrownBy(() -> registry.register(new DonorRegistration("X", "C+", A, "2025-01-01")))
                .isInstanceOf(MatchingException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_BLOOD_TYPE);
        assertThat(registry.size()).isZero();
    }

    @Test
    void rejectsUnknownSite() {
        assertThatThrownBy(() -> registry.register(new DonorRegistration("X", "O-", "Hospital Z", "2025-01-01")))
                .isInstanceOf(MatchingException.class)
                .hasMessage("Unknown location: Hospital Z");
        assertThat(registry.size()).isZero();
    }

    @Test
    void unparsableDateIsStoredAsUnknownAndNeverEligible() {
        Donor garbled = registry.register(new DonorRegistration("Garbled", "O-", A, "01/02/2025"));
        Donor missing = registry.register(new DonorRegistration("Missing", "O-", A, null));

        assertThat(garbled.getLastDonationDate()).isNull();
        assertThat(missing.getLastDonationDate()).isNull();
        assertThat(registry.isEligible(garbled, TODAY)).isFalse();
        assertThat(registry.isEligible(missing, TODAY)).isFalse();
    }

    @Test
    void markDonatedResetsCooldownAndCountsDonation() {
        Donor donor = registry.register(new DonorRegistration("Bob", "A-", A, "2025-01-01", 2));
        assertThat(registry.isEligible(donor, TODAY)).isTrue();

        registry.markDonated(donor, TODAY);

        assertThat(donor.getLastDonationDate()).isEqualTo(TODAY);
        assertThat(donor.getTotalDonations()).isEqualTo(3);
        assertThat(registry.isEligible(donor, TODAY)).isFalse();
        assertThat(registry.isEligible(donor, TODAY.plusDays(90))).isTrue();
    }

    @Test
    void listsAreReadOnly() {
        registry.register(new DonorRegistration("Bob", "A-", A, "2025-01-01"));

        assertThatThrownBy(() -> registry.listAll().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> registry.listByType(BloodType.A_NEGATIVE).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
