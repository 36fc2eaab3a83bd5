package org.bloodmatch.engine.domain.service;

import org.bloodmatch.engine.domain.model.BloodType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.bloodmatch.engine.domain.model.BloodType.AB_NEGATIVE;
import static org.bloodmatch.engine.domain.model.BloodType.AB_POSITIVE;
import static org.bloodmatch.engine.domain.model.BloodType.A_NEGATIVE;
import static org.bloodmatch.engine.domain.model.BloodType.A_POSITIVE;
import static org.bloodmatch.engine.domain.model.BloodType.B_NEGATIVE;
import static org.bloodmatch.engine.domain.model.BloodType.B_POSITIVE;
import static org.bloodmatch.engine.domain.model.BloodType.O_NEGATIVE;
import static org.bloodmatch.engine.domain.model.BloodType.O_POSITIVE;

/**
 * Red cell compatibility: which donor types each patient type may receive from.
 * The table is directed (O- gives to everyone, AB+ receives from everyone).
 */
public final class BloodTypeCompatibility {

    private static final Map<BloodType, List<BloodType>> COMPATIBLE_DONORS = new EnumMap<>(BloodType.class);

    static {
        COMPATIBLE_DONORS.put(O_NEGATIVE, List.of(O_NEGATIVE));
        COMPATIBLE_DONORS.put(O_POSITIVE, List.of(O_NEGATIVE, O_POSITIVE));
        COMPATIBLE_DONORS.put(A_NEGATIVE, List.of(O_NEGATIVE, A_NEGATIVE));
        COMPATIBLE_DONORS.put(A_POSITIVE, List.of(O_NEGATIVE, O_POSITIVE, A_NEGATIVE, A_POSITIVE));
        COMPATIBLE_DONORS.put(B_NEGATIVE, List.of(O_NEGATIVE, B_NEGATIVE));
        COMPATIBLE_DONORS.put(B_POSITIVE, List.of(O_NEGATIVE, O_POSITIVE, B_NEGATIVE, B_POSITIVE));
        COMPATIBLE_DONORS.put(AB_NEGATIVE, List.of(O_NEGATIVE, A_NEGATIVE, B_NEGATIVE, AB_NEGATIVE));
        COMPATIBLE_DONORS.put(AB_POSITIVE, Collections.unmodifiableList(Arrays.asList(BloodType.values())));
    }

    private BloodTypeCompatibility() {
    }

    /**
     * Donor types a patient of the given type may receive from, in canonical order.
     */
    public static List<BloodType> compatibleDonorTypes(BloodType patientType) {
        return COMPATIBLE_DONORS.get(patientType);
    }

    /**
     * Same as {@link #compatibleDonorTypes(BloodType)} for a raw, unnormalized value.
     *
     * @throws org.bloodmatch.engine.domain.exception.MatchingException if the value is not a canonical type
     */
    public static List<BloodType> compatibleDonorTypes(String patientType) {
        return compatibleDonorTypes(BloodType.parse(patientType));
    }

    public static boolean canReceive(BloodType patientType, BloodType donorType) {
        return COMPATIBLE_DONORS.get(patientType).contains(donorType);
    }
}
