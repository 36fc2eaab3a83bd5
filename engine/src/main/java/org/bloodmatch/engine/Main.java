package org.bloodmatch.engine;

import org.bloodmatch.engine.config.EngineConfig;
import org.bloodmatch.engine.config.SiteGraphLoader;
import org.bloodmatch.engine.domain.service.DistanceGraph;
import org.bloodmatch.engine.domain.service.EligibilityRule;
import org.bloodmatch.engine.engine.BloodMatchEngine;
import org.bloodmatch.engine.http.MatchingHttpServer;
import org.bloodmatch.engine.seed.SampleDonorSeeder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the blood donor matching engine.
 *
 * Builds the engine context once, optionally seeds the sample donors and
 * serves the JSON API until the process is stopped.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Blood Donor Matching Engine ===");

        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        configureLogging(config);

        DistanceGraph graph = SiteGraphLoader.load(config.getSitesFile());
        EligibilityRule eligibilityRule = new EligibilityRule(config.getCooldownDays());
        BloodMatchEngine engine = BloodMatchEngine.create(graph, eligibilityRule, Clock.systemDefaultZone());

        if (config.isSeedSampleDonors()) {
            new SampleDonorSeeder(engine).seedDefaults();
        } else {
            LOG.info("Sample donor seeding disabled");
        }

        MatchingHttpServer httpServer = new MatchingHttpServer(config.getPort(), engine);
        httpServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            httpServer.stop();
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Matching engine started successfully ===");
        LOG.info(() -> "Sites: " + graph.getSites());
        LOG.info(() -> "  - Health: http://localhost:" + httpServer.getPort() + "/health");
        LOG.info(() -> "  - API:    http://localhost:" + httpServer.getPort() + "/api/");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
