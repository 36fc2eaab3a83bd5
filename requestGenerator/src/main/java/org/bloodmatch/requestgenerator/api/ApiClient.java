package org.bloodmatch.requestgenerator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.bloodmatch.requestgenerator.model.EmergencyRequest;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * API client for submitting emergency requests to the matching engine.
 */
public final class ApiClient {
    private static final Logger LOG = Logger.getLogger(ApiClient.class.getName());
    private static final OkHttpClient HTTP = new OkHttpClient.Builder()
            .connectTimeout(5, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .build();
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final int NOT_FOUND = 404;

    private final List<String> sites = new ArrayList<>();
    private final ApiService api;

    public ApiClient(String baseUrlRaw) {
        String normalized = baseUrlRaw.endsWith("/") ? baseUrlRaw : baseUrlRaw + "/";

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalized)
                .addConverterFactory(JacksonConverterFactory.create(OBJECT_MAPPER))
                .client(HTTP)
                .build();
        this.api = retrofit.create(ApiService.class);
    }

    /**
     * Submit a generated request to the emergency queue.
     *
     * @return the ticket id assigned by the engine, or null on failure
     */
    public String submitEmergency(EmergencyRequest request) {
        EmergencyRequestBody payload = new EmergencyRequestBody(request.getUrgency(),
                new PatientBody(request.getBloodGroup(), request.getLocation()));
        SubmitResponse created = execute(api.submitEmergency(payload), "POST /api/emergency");
        if (created != null && created.requestId != null) {
            LOG.log(Level.INFO, "[API] Emergency queued (id={0}, position={1})",
                    new Object[]{created.requestId, created.positionInQueue});
            return created.requestId;
        }
        return null;
    }

    /**
     * Ask the engine to process the most urgent queued request.
     *
     * @return the processing result, or null when the queue was empty or the call failed
     */
    public ProcessResult processNext() {
        try {
            Response<ProcessResult> resp = api.processNext().execute();
            if (resp.code() == NOT_FOUND) {
                LOG.fine("[API] Emergency queue is empty");
                return null;
            }
            if (!resp.isSuccessful()) {
                LOG.log(Level.SEVERE, "[API] POST /api/emergency/process -> {0} body={1}",
                        new Object[]{resp.code(), errorBody(resp)});
                return null;
            }
            ProcessResult result = resp.body();
            if (result != null) {
                LOG.log(Level.INFO, "[API] Processed emergency: matched={0}, remaining={1}",
                        new Object[]{result.isMatchFound(), result.getRemainingRequests()});
            }
            return result;
        } catch (IOException e) {
            LOG.log(Level.SEVERE, e, () -> "[API] POST /api/emergency/process error");
            return null;
        }
    }

    /**
     * Sites known to the engine, as loaded by the last successful call to {@link #waitForApi}.
     */
    public List<String> getSites() {
        return Collections.unmodifiableList(sites);
    }

    public boolean isAvailable() {
        return !sites.isEmpty();
    }

    /**
     * Wait for the engine to answer with its site list.
     *
     * @param maxRetries maximum number of attempts
     * @param retryDelayMs delay between attempts in milliseconds
     * @return true if the engine became available
     */
    public boolean waitForApi(int maxRetries, long retryDelayMs) {
        for (int i = 0; i < maxRetries; i++) {
            loadSites();
            if (isAvailable()) {
                return true;
            }
            LOG.log(Level.INFO, "[API] Waiting for engine to become available... ({0}/{1})",
                    new Object[]{i + 1, maxRetries});
            try {
                Thread.sleep(retryDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return isAvailable();
    }

    // ---- helpers ----

    private void loadSites() {
        sites.clear();
        List<String> loaded = execute(api.getSites(), "GET /api/sites");
        if (loaded != null) {
            sites.addAll(loaded);
            LOG.log(Level.INFO, "[API] Sites: {0}", sites);
        }
    }

    private <T> T execute(Call<T> call, String action) {
        try {
            Response<T> resp = call.execute();
            if (!resp.isSuccessful()) {
                LOG.log(Level.SEVERE, "[API] {0} -> {1} body={2}", new Object[]{action, resp.code(), errorBody(resp)});
                return null;
            }
            return resp.body();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] {0} error: {1}", new Object[]{action, e.getMessage()});
            return null;
        }
    }

    private String errorBody(Response<?> resp) {
        try {
            return resp.errorBody() == null ? "" : resp.errorBody().string();
        } catch (IOException e) {
            LOG.log(Level.FINE, "[API] Could not read error body", e);
            return "";
        }
    }

    // ---- Retrofit service interface ----

    private interface ApiService {
        @GET("api/sites")
        Call<List<String>> getSites();

        @POST("api/emergency")
        Call<SubmitResponse> submitEmergency(@Body EmergencyRequestBody body);

        @POST("api/emergency/process")
        Call<ProcessResult> processNext();
    }

    // ---- DTOs ----

    private static final class PatientBody {
        @JsonProperty("blood_group")
        private final String bloodGroup;
        @JsonProperty("location")
        private final String location;

        PatientBody(String bloodGroup, String location) {
            this.bloodGroup = bloodGroup;
            this.location = location;
        }
    }

    private static final class EmergencyRequestBody {
        @JsonProperty("urgency_level")
        private final int urgencyLevel;
        @JsonProperty("patient")
        private final PatientBody patient;

        EmergencyRequestBody(int urgencyLevel, PatientBody patient) {
            this.urgencyLevel = urgencyLevel;
            this.patient = patient;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class SubmitResponse {
        @JsonProperty("request_id")
        private String requestId;
        @JsonProperty("position_in_queue")
        private int positionInQueue;
    }

    /**
     * Outcome of processing one queued emergency request.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ProcessResult {
        @JsonProperty("match_found")
        private boolean matchFound;
        @JsonProperty("urgency_level")
        private int urgencyLevel;
        @JsonProperty("distance_km")
        private Double distanceKm;
        @JsonProperty("error")
        private String error;
        @JsonProperty("remaining_requests")
        private int remainingRequests;

        public boolean isMatchFound() {
            return matchFound;
        }

        public int getUrgencyLevel() {
            return urgencyLevel;
        }

        public Double getDistanceKm() {
            return distanceKm;
        }

        public String getError() {
            return error;
        }

        public int getRemainingRequests() {
            return remainingRequests;
        }
    }
}
