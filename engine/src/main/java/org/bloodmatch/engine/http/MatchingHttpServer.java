package org.bloodmatch.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.bloodmatch.engine.api.dto.BloodTypeStatsDto;
import org.bloodmatch.engine.api.dto.DonorDto;
import org.bloodmatch.engine.api.dto.DonorRequestDto;
import org.bloodmatch.engine.api.dto.EmergencyRequestDto;
import org.bloodmatch.engine.api.dto.MatchDto;
import org.bloodmatch.engine.api.dto.PatientDto;
import org.bloodmatch.engine.api.dto.TicketDto;
import org.bloodmatch.engine.domain.exception.ErrorCode;
import org.bloodmatch.engine.domain.exception.MatchingException;
import org.bloodmatch.engine.domain.model.BloodTypeStats;
import org.bloodmatch.engine.domain.model.Donor;
import org.bloodmatch.engine.domain.model.EmergencyOutcome;
import org.bloodmatch.engine.domain.model.EmergencyTicket;
import org.bloodmatch.engine.domain.model.MatchRecord;
import org.bloodmatch.engine.domain.model.QueuedEmergency;
import org.bloodmatch.engine.engine.BloodMatchEngine;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * JSON-over-HTTP boundary for the matching engine.
 * Each endpoint maps to exactly one engine operation.
 */
public final class MatchingHttpServer {

    private static final Logger LOG = Logger.getLogger(MatchingHttpServer.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String GET = "GET";
    private static final String POST = "POST";

    private final HttpServer server;
    private final ExecutorService executor;
    private final BloodMatchEngine engine;

    /**
     * @param port TCP port to bind; 0 picks a free port
     */
    public MatchingHttpServer(int port, BloodMatchEngine engine) throws IOException {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "HTTP server initialized on port " + getPort());
    }

    private void registerHandlers() {
        route("/health", GET, this::health);
        route("/api/sites", GET, this::sites);
        server.createContext("/api/donors", exchange -> {
            if (POST.equalsIgnoreCase(exchange.getRequestMethod())) {
                handle(exchange, "/api/donors", POST, this::registerDonor);
            } else {
                handle(exchange, "/api/donors", GET, this::listDonors);
            }
        });
        route("/api/donors/search", GET, this::searchDonors);
        route("/api/match", GET, this::matchDonor);
        route("/api/emergency", POST, this::submitEmergency);
        route("/api/emergency/process", POST, this::processEmergency);
        route("/api/emergency/queue", GET, this::viewEmergencyQueue);
        route("/api/stats", GET, this::stats);
        route("/api/matching-history", GET, this::matchingHistory);
    }

    public void start() {
        server.start();
        LOG.info("HTTP server started");
    }

    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("HTTP server stopped");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    // ---- endpoints ----

    private Reply health(HttpExchange exchange) {
        return Reply.ok(Collections.singletonMap("status", "healthy"));
    }

    private Reply sites(HttpExchange exchange) {
        return Reply.ok(new ArrayList<>(engine.getSites()));
    }

    /**
     * POST /api/donors
     */
    private Reply registerDonor(HttpExchange exchange) throws IOException {
        DonorRequestDto request = readBody(exchange, DonorRequestDto.class);
        Donor donor = engine.registerDonor(request.toRegistration());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Donor added successfully");
        body.put("donor", toDto(donor));
        return new Reply(201, body);
    }

    /**
     * GET /api/donors
     */
    private Reply listDonors(HttpExchange exchange) {
        return Reply.ok(toDtos(engine.listDonors()));
    }

    /**
     * GET /api/donors/search?blood_group=
     */
    private Reply searchDonors(HttpExchange exchange) {
        Map<String, String> query = parseQuery(exchange.getRequestURI());
        String bloodGroup = requireParam(query, "blood_group");
        return Reply.ok(toDtos(engine.listDonorsByType(bloodGroup)));
    }

    /**
     * GET /api/match?blood_group=&location=
     */
    private Reply matchDonor(HttpExchange exchange) {
        Map<String, String> query = parseQuery(exchange.getRequestURI());
        String bloodGroup = requireParam(query, "blood_group");
        String location = decodeFormValue(requireParam(query, "location"));

        MatchRecord match = engine.match(bloodGroup, location);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("match_found", true);
        body.put("donor", toDto(match.getDonor()));
        body.put("distance_km", match.getDistanceKm());
        return Reply.ok(body);
    }

    /**
     * POST /api/emergency
     */
    private Reply submitEmergency(HttpExchange exchange) throws IOException {
        EmergencyRequestDto request = readBody(exchange, EmergencyRequestDto.class);
        int urgency = request.resolveUrgency();
        PatientDto patient = request.requirePatient();

        QueuedEmergency queued = engine.submitEmergency(urgency, patient.getBloodGroup(), patient.getLocation());
        EmergencyTicket ticket = queued.getTicket();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Emergency request added to queue");
        body.put("request_id", ticket.getId());
        body.put("urgency_level", ticket.getUrgency());
        body.put("sequence", ticket.getSequence());
        body.put("position_in_queue", queued.getQueueSize());
        return new Reply(201, body);
    }

    /**
     * POST /api/emergency/process
     */
    private Reply processEmergency(HttpExchange exchange) {
        EmergencyOutcome outcome = engine.processNextEmergency();
        EmergencyTicket ticket = outcome.getTicket();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("request", TicketDto.from(ticket));
        body.put("urgency_level", ticket.getUrgency());
        body.put("match_found", outcome.isMatched());
        if (outcome.isMatched()) {
            MatchRecord match = outcome.getMatch().get();
            body.put("message", "Emergency request processed successfully");
            body.put("donor", toDto(match.getDonor()));
            body.put("distance_km", match.getDistanceKm());
        } else {
            MatchingException failure = outcome.getFailure().get();
            body.put("message", "Emergency request processed but no match found");
            body.put("error", failure.getMessage());
            body.put("code", failure.getCode().name());
        }
        body.put("remaining_requests", outcome.getRemaining());
        return Reply.ok(body);
    }

    /**
     * GET /api/emergency/queue
     */
    private Reply viewEmergencyQueue(HttpExchange exchange) {
        List<EmergencyTicket> queue = engine.peekEmergencyQueue();

        Map<String, Object> body = new LinkedHashMap<>();
        if (queue.isEmpty()) {
            body.put("message", "No emergency requests in queue");
        }
        body.put("total_requests", queue.size());
        body.put("queue", queue.stream().map(TicketDto::from).collect(Collectors.toList()));
        return Reply.ok(body);
    }

    /**
     * GET /api/stats
     */
    private Reply stats(HttpExchange exchange) {
        Map<String, BloodTypeStatsDto> body = new LinkedHashMap<>();
        for (BloodTypeStats stats : engine.statistics()) {
            body.put(stats.getBloodType().getLabel(), BloodTypeStatsDto.from(stats));
        }
        return Reply.ok(body);
    }

    /**
     * GET /api/matching-history
     */
    private Reply matchingHistory(HttpExchange exchange) {
        List<MatchRecord> history = engine.matchHistory();
        List<MatchDto> matches = new ArrayList<>(history.size());
        // newest first, so the ledger position counts down
        long position = history.size();
        for (MatchRecord record : history) {
            matches.add(MatchDto.from(position--, record));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_matches", matches.size());
        body.put("matches", matches);
        return Reply.ok(body);
    }

    // ---- plumbing ----

    private void route(String path, String method, Endpoint endpoint) {
        server.createContext(path, exchange -> handle(exchange, path, method, endpoint));
    }

    private void handle(HttpExchange exchange, String path, String method, Endpoint endpoint) throws IOException {
        LOG.log(Level.FINE, "[HTTP] <-- {0} {1} from {2}",
                new Object[]{exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress()});
        try {
            if (!isExactPath(exchange, path)) {
                sendJson(exchange, 404, errorBody("not found", null));
                return;
            }
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                sendJson(exchange, 405, errorBody("method not allowed", null));
                return;
            }
            Reply reply = endpoint.handle(exchange);
            sendJson(exchange, reply.status, reply.body);
        } catch (MatchingException e) {
            LOG.log(Level.INFO, "[HTTP] {0} {1} rejected: {2}",
                    new Object[]{exchange.getRequestMethod(), path, e.getMessage()});
            sendJson(exchange, e.getCode().getHttpStatus(), errorBody(e.getMessage(), e.getCode()));
        } catch (JsonProcessingException e) {
            LOG.log(Level.INFO, "[HTTP] {0} {1} malformed body: {2}",
                    new Object[]{exchange.getRequestMethod(), path, e.getOriginalMessage()});
            sendJson(exchange, 400, errorBody("malformed JSON body", null));
        } catch (Exception e) {
            LOG.log(Level.SEVERE, e, () -> "[HTTP] " + exchange.getRequestMethod() + " " + path + " failed");
            sendJson(exchange, 500, errorBody(String.valueOf(e.getMessage()), null));
        } finally {
            exchange.close();
        }
    }

    private static boolean isExactPath(HttpExchange exchange, String path) {
        String requested = exchange.getRequestURI().getPath();
        if (requested.length() > 1 && requested.endsWith("/")) {
            requested = requested.substring(0, requested.length() - 1);
        }
        return requested.equals(path);
    }

    private static Map<String, Object> errorBody(String message, ErrorCode code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (code != null) {
            body.put("code", code.name());
        }
        return body;
    }

    private static <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) {
                throw MatchingException.missingField("body");
            }
            T value = MAPPER.readValue(bytes, type);
            if (value == null) {
                throw MatchingException.missingField("body");
            }
            return value;
        }
    }

    /**
     * Split the raw query string. Values stay percent-encoded: blood groups
     * must keep a literal '+', which form decoding would turn into a space.
     */
    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> result = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return result;
        }
        for (String pair : raw.split("&")) {
            int idx = pair.indexOf('=');
            String key = idx >= 0 ? pair.substring(0, idx) : pair;
            String value = idx >= 0 ? pair.substring(idx + 1) : "";
            result.putIfAbsent(decodeFormValue(key), value);
        }
        return result;
    }

    static String decodeFormValue(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static String requireParam(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null || value.trim().isEmpty()) {
            throw new MatchingException(ErrorCode.MISSING_FIELD, name + " parameter required");
        }
        return value;
    }

    private DonorDto toDto(Donor donor) {
        return DonorDto.from(donor, engine.isEligible(donor));
    }

    private List<DonorDto> toDtos(List<Donor> donors) {
        return donors.stream().map(this::toDto).collect(Collectors.toList());
    }

    private static void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Endpoint {
        Reply handle(HttpExchange exchange) throws IOException;
    }

    private static final class Reply {
        private final int status;
        private final Object body;

        Reply(int status, Object body) {
            this.status = status;
            this.body = body;
        }

        static Reply ok(Object body) {
            return new Reply(200, body);
        }
    }
}
