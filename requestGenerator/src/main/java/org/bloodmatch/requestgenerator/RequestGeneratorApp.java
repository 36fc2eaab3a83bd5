package org.bloodmatch.requestgenerator;

import io.github.cdimascio.dotenv.Dotenv;
import org.bloodmatch.requestgenerator.api.ApiClient;
import org.bloodmatch.requestgenerator.generator.EmergencyRequestGenerator;
import org.bloodmatch.requestgenerator.model.EmergencyRequest;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Standalone emergency request generator for the matching engine.
 *
 * Submits a random emergency request every interval and asks the engine to
 * process its queue after every N submissions. Runs independently of the
 * engine process.
 */
public class RequestGeneratorApp {
    private static final Logger LOG = Logger.getLogger(RequestGeneratorApp.class.getName());

    private static final String API_BASE_URL_KEY = "API_BASE_URL";
    private static final String REQUEST_INTERVAL_KEY = "REQUEST_INTERVAL_SECONDS";
    private static final String PROCESS_EVERY_KEY = "PROCESS_EVERY_N_REQUESTS";

    private static final String DEFAULT_API_BASE_URL = "http://localhost:5000";
    private static final long DEFAULT_INTERVAL_SECONDS = 30;
    private static final long DEFAULT_PROCESS_EVERY = 3;
    private static final int API_RETRY_COUNT = 30;
    private static final long API_RETRY_DELAY_MS = 2000;

    public static void main(String[] args) {
        String apiBaseUrl = resolveEnv(API_BASE_URL_KEY, DEFAULT_API_BASE_URL);
        long intervalSeconds = resolveLong(REQUEST_INTERVAL_KEY, DEFAULT_INTERVAL_SECONDS);
        long processEvery = resolveLong(PROCESS_EVERY_KEY, DEFAULT_PROCESS_EVERY);

        LOG.log(Level.INFO, "[RequestGenerator] Starting with API={0}, interval={1}s, processEvery={2}",
                new Object[]{apiBaseUrl, intervalSeconds, processEvery});

        ApiClient api = new ApiClient(apiBaseUrl);

        LOG.info("[RequestGenerator] Waiting for engine to become available...");
        if (!api.waitForApi(API_RETRY_COUNT, API_RETRY_DELAY_MS)) {
            LOG.severe("[RequestGenerator] Engine not available after retries. Exiting.");
            System.exit(1);
        }

        EmergencyRequestGenerator generator = new EmergencyRequestGenerator(api.getSites());
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

        scheduler.scheduleAtFixedRate(() -> {
            try {
                EmergencyRequest request = generator.nextRequest();
                String ticketId = api.submitEmergency(request);
                if (ticketId == null) {
                    LOG.log(Level.WARNING, "[RequestGenerator] Failed to submit request #{0}", request.getNumber());
                }
                if (processEvery > 0 && request.getNumber() % processEvery == 0) {
                    api.processNext();
                }
            } catch (Exception e) {
                LOG.log(Level.SEVERE, "[RequestGenerator] Error in tick", e);
            }
        }, 0, intervalSeconds, TimeUnit.SECONDS);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("[RequestGenerator] Shutting down...");
            scheduler.shutdownNow();
        }));

        LOG.log(Level.INFO, "[RequestGenerator] Service started. Submitting a request every {0} seconds.",
                intervalSeconds);
    }

    private static long resolveLong(String key, long defaultValue) {
        String value = resolveEnv(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value);
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            LOG.log(Level.WARNING, "[RequestGenerator] Invalid number for {0}: {1}, using {2}",
                    new Object[]{key, value, defaultValue});
            return defaultValue;
        }
    }

    private static String resolveEnv(String key, String defaultValue) {
        String fromEnv = System.getenv(key);
        if (fromEnv != null && !fromEnv.trim().isEmpty()) {
            return fromEnv.trim();
        }

        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        String fromDotEnv = dotenv.get(key);
        if (fromDotEnv != null && !fromDotEnv.trim().isEmpty()) {
            return fromDotEnv.trim();
        }

        Dotenv parentDotenv = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        String fromParent = parentDotenv.get(key);
        if (fromParent != null && !fromParent.trim().isEmpty()) {
            return fromParent.trim();
        }

        return defaultValue;
    }
}
