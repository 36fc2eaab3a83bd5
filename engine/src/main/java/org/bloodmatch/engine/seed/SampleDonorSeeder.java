package org.bloodmatch.engine.seed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bloodmatch.engine.api.dto.DonorRequestDto;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.engine.BloodMatchEngine;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers the bundled sample donors into a fresh engine.
 */
public final class SampleDonorSeeder {

    private static final Logger LOG = Logger.getLogger(SampleDonorSeeder.class.getName());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "/sample-donors.json";

    private final BloodMatchEngine engine;

    public SampleDonorSeeder(BloodMatchEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Register every donor of the bundled sample set.
     *
     * @return number of donors registered
     */
    public int seedDefaults() throws IOException {
        try (InputStream in = SampleDonorSeeder.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing bundled resource " + DEFAULT_RESOURCE);
            }
            return seed(in);
        }
    }

    /**
     * Register every donor of a JSON array. Invalid entries are skipped with a warning.
     *
     * @return number of donors registered
     */
    public int seed(InputStream in) throws IOException {
        List<DonorRequestDto> donors = OBJECT_MAPPER.readValue(in, new TypeReference<List<DonorRequestDto>>() { });
        int registered = 0;
        for (DonorRequestDto dto : donors) {
            try {
                engine.registerDonor(dto.toRegistration());
                registered++;
            } catch (MatchingException e) {
                LOG.log(Level.WARNING, "Skipping sample donor {0}: {1}", new Object[]{dto.getName(), e.getMessage()});
            }
        }
        final int count = registered;
        LOG.info(() -> "Sample donors added: " + count);
        return registered;
    }
}
