package org.bloodmatch.engine.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bloodmatch.engine.domain.service.DistanceGraph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the site graph from JSON.
 *
 * <pre>
 * {"sites": ["Hospital A", ...],
 *  "edges": [{"from": "Hospital A", "to": "Hospital B", "km": 15}, ...]}
 * </pre>
 */
public final class SiteGraphLoader {

    private static final Logger LOG = Logger.getLogger(SiteGraphLoader.class.getName());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "/default-sites.json";

    private SiteGraphLoader() {
    }

    /**
     * Load from the given file, or from the bundled default when {@code path} is empty.
     *
     * @throws IOException if the document cannot be read
     * @throws IllegalArgumentException if the document describes an invalid graph
     */
    public static DistanceGraph load(String path) throws IOException {
        if (path == null || path.trim().isEmpty()) {
            return loadDefault();
        }
        Path file = Paths.get(path.trim());
        LOG.info(() -> "Loading site graph from " + file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static DistanceGraph loadDefault() throws IOException {
        try (InputStream in = SiteGraphLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing bundled resource " + DEFAULT_RESOURCE);
            }
            return read(in);
        }
    }

    public static DistanceGraph read(InputStream in) throws IOException {
        SiteGraphDocument doc = OBJECT_MAPPER.readValue(in, SiteGraphDocument.class);
        if (doc.sites == null || doc.sites.isEmpty()) {
            throw new IllegalArgumentException("site graph declares no sites");
        }

        DistanceGraph.Builder builder = new DistanceGraph.Builder();
        for (String site : doc.sites) {
            builder.site(site);
        }
        if (doc.edges != null) {
            for (EdgeDocument edge : doc.edges) {
                if (edge.from == null || edge.to == null || edge.km == null) {
                    throw new IllegalArgumentException("edge requires from, to and km");
                }
                builder.edge(edge.from, edge.to, edge.km);
            }
        }
        int edgeCount = doc.edges == null ? 0 : doc.edges.size();
        LOG.info(() -> String.format("Site graph: %d sites, %d edges", doc.sites.size(), edgeCount));
        return builder.build();
    }

    // ---- JSON documents ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class SiteGraphDocument {
        @JsonProperty("sites")
        private List<String> sites;
        @JsonProperty("edges")
        private List<EdgeDocument> edges;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class EdgeDocument {
        @JsonProperty("from")
        private String from;
        @JsonProperty("to")
        private String to;
        @JsonProperty("km")
        private Double km;
    }
}
