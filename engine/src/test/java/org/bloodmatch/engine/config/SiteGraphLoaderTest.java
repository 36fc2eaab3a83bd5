package org.bloodmatch.engine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bloodmatch.engine.domain.service.DistanceGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SiteGraphLoaderTest {

    @Test
    void bundledGraphHasFourHospitals() throws IOException {
        DistanceGraph graph = SiteGraphLoader.load("");

        assertThat(graph.getSites()).containsExactly("Hospital A", "Hospital B", "Hospital C", "Hospital D");
        assertThat(graph.shortestDistance("Hospital A", "Hospital C")).isEqualTo(23.0);
        assertThat(graph.shortestDistance("Hospital D", "Hospital B")).isEqualTo(10.0);
    }

    @Test
    void loadsGraphFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sites.json");
        Files.write(file, ("{\"sites\": [\"North\", \"South\", \"East\"],"
                + " \"edges\": [{\"from\": \"North\", \"to\": \"South\", \"km\": 12.5},"
                + " {\"from\": \"South\", \"to\": \"East\", \"km\": 4}]}").getBytes(StandardCharsets.UTF_8));

        DistanceGraph graph = SiteGraphLoader.load(file.toString());

        assertThat(graph.getSites()).containsExactly("North", "South", "East");
        assertThat(graph.shortestDistance("North", "East")).isEqualTo(16.5);
    }

    @Test
    void rejectsGraphWithoutSites() {
        assertThatThrownBy(() -> SiteGraphLoader.read(json("{\"sites\": [], \"edges\": []}")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsIncompleteEdge() {
        assertThatThrownBy(() -> SiteGraphLoader.read(json("{\"sites\": [\"X\", \"Y\"], \"edges\": [{\"from\": \"X\", \"to\": \"Y\"}]}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("km");
    }

    @Test
    void rejectsEdgeToUndeclaredSite() {
        assertThatThrownBy(() -> SiteGraphLoader.read(json("{\"sites\": [\"X\"], \"edges\": [{\"from\": \"X\", \"to\": \"Y\", \"km\": 1}]}")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> SiteGraphLoader.load("/does/not/exist/sites.json"))
                .isInstanceOf(IOException.class);
    }

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
