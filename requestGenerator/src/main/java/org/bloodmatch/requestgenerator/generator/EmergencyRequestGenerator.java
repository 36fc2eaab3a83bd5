package org.bloodmatch.requestgenerator.generator;

import org.bloodmatch.requestgenerator.model.EmergencyRequest;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Random emergency request generator.
 *
 * Urgency distribution:
 * - 10%: urgency 1 (critical)
 * - 20%: urgency 2
 * - 40%: urgency 3
 * - 30%: urgency 4 or 5
 *
 * Blood groups follow a typical population frequency; locations are drawn
 * uniformly from the sites the engine knows.
 */
public final class EmergencyRequestGenerator {
    private static final Logger LOG = Logger.getLogger(EmergencyRequestGenerator.class.getName());

    // Approximate share per 1000 people
    private static final String[] BLOOD_GROUPS = {"O+", "A+", "B+", "O-", "A-", "AB+", "B-", "AB-"};
    private static final int[] BLOOD_GROUP_WEIGHTS = {374, 357, 85, 66, 63, 34, 15, 6};
    private static final int BLOOD_GROUP_WEIGHT_TOTAL;

    static {
        int total = 0;
        for (int weight : BLOOD_GROUP_WEIGHTS) {
            total += weight;
        }
        BLOOD_GROUP_WEIGHT_TOTAL = total;
    }

    private final Random random;
    private final Clock clock;
    private final List<String> locations;

    private int requestSequence = 0;

    public EmergencyRequestGenerator(List<String> locations) {
        this(locations, new Random(), Clock.systemUTC());
    }

    public EmergencyRequestGenerator(List<String> locations, Random random, Clock clock) {
        Objects.requireNonNull(locations, "locations must not be null");
        if (locations.isEmpty()) {
            throw new IllegalArgumentException("at least one location is required");
        }
        this.locations = new ArrayList<>(locations);
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generate the next request.
     */
    public EmergencyRequest nextRequest() {
        int urgency = selectWeightedUrgency();
        String bloodGroup = selectWeightedBloodGroup();
        String location = locations.get(random.nextInt(locations.size()));
        int number = ++requestSequence;

        EmergencyRequest request = new EmergencyRequest(number, urgency, bloodGroup, location, clock.instant());
        LOG.log(Level.INFO, "[Generator] Generated request #{0}: urgency={1}, blood={2}, location={3}",
                new Object[]{number, urgency, bloodGroup, location});
        return request;
    }

    public int getRequestSequence() {
        return requestSequence;
    }

    private int selectWeightedUrgency() {
        int roll = random.nextInt(100);  // 0-99

        if (roll < 10) {
            return 1;
        } else if (roll < 30) {
            return 2;
        } else if (roll < 70) {
            return 3;
        } else {
            return 4 + random.nextInt(2);  // 4 or 5
        }
    }

    private String selectWeightedBloodGroup() {
        int roll = random.nextInt(BLOOD_GROUP_WEIGHT_TOTAL);
        for (int i = 0; i < BLOOD_GROUPS.length; i++) {
            roll -= BLOOD_GROUP_WEIGHTS[i];
            if (roll < 0) {
                return BLOOD_GROUPS[i];
            }
        }
        return BLOOD_GROUPS[0];
    }
}
