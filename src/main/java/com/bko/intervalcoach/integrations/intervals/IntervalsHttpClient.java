package com.bko.intervalcoach.integrations.intervals;

import com.bko.intervalcoach.shared.AppSettings;
import com.bko.intervalcoach.shared.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.HttpResponseException;
import org.apache.hc.client5.http.fluent.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

@Component
public class IntervalsHttpClient implements IntervalsClientPort {
    private static final Logger logger = LoggerFactory.getLogger(IntervalsHttpClient.class);
    private static final String CURVE_WINDOWS = "42d,s0";

    private final String athleteId;
    private final String apiKey;
    private final String baseUrl;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public IntervalsHttpClient(AppSettings settings) {
        this.athleteId = settings.intervals().athleteId();
        this.apiKey = settings.intervals().apiKey();
        this.baseUrl = stripTrailingSlash(settings.intervals().baseUrl());
        this.retryPolicy = settings.coach().providerRetry();
    }

    @Override
    public List<IntervalsActivity> getActivities(LocalDate oldest, LocalDate newest) throws IOException {
        String body = executeRequest("/athlete/" + athleteId + "/activities" + range(oldest, newest));
        return Arrays.asList(objectMapper.readValue(body, IntervalsActivity[].class));
    }

    @Override
    public List<IntervalsWellness> getWellness(LocalDate oldest, LocalDate newest) throws IOException {
        String body = executeRequest("/athlete/" + athleteId + "/wellness" + range(oldest, newest));
        return Arrays.asList(objectMapper.readValue(body, IntervalsWellness[].class));
    }

    @Override
    public List<IntervalsEvent> getEvents(LocalDate oldest, LocalDate newest) throws IOException {
        String body = executeRequest("/athlete/" + athleteId + "/events" + range(oldest, newest));
        return Arrays.asList(objectMapper.readValue(body, IntervalsEvent[].class));
    }

    @Override
    public IntervalsAthlete getAthlete() throws IOException {
        String body = executeRequest("/athlete/" + athleteId);
        return objectMapper.readValue(body, IntervalsAthlete.class);
    }

    @Override
    public List<IntervalsPowerCurve> getPowerCurves() throws IOException {
        String body = executeRequest("/athlete/" + athleteId + "/power-curves?type=Ride&curves=" + CURVE_WINDOWS);
        JsonNode root = objectMapper.readTree(body);
        JsonNode list = root.isArray() ? root : root.path("list");
        List<IntervalsPowerCurve> curves = new ArrayList<>();
        for (JsonNode node : list) {
            curves.add(parseCurve(node));
        }
        return curves;
    }

    private IntervalsPowerCurve parseCurve(JsonNode node) {
        List<Integer> secs = new ArrayList<>();
        for (JsonNode value : node.path("secs")) {
            secs.add(value.asInt());
        }
        List<Double> watts = new ArrayList<>();
        JsonNode values = node.has("watts") ? node.path("watts") : node.path("values");
        for (JsonNode value : values) {
            watts.add(value.asDouble());
        }
        Double eftp = null;
        Double wPrime = null;
        for (JsonNode model : node.path("powerModels")) {
            if (eftp == null && model.path("ftp").isNumber()) {
                eftp = model.path("ftp").asDouble();
            }
            if (wPrime == null && model.path("wPrime").isNumber()) {
                wPrime = model.path("wPrime").asDouble();
            }
        }
        return new IntervalsPowerCurve(node.path("label").asText(null), secs, watts, eftp, wPrime);
    }

    private String executeRequest(String path) throws IOException {
        String url = baseUrl + path;
        return retryPolicy.execute("GET " + path, () -> {
            try {
                return Request.get(url)
                        .addHeader("Authorization", authorization())
                        .addHeader("Accept", "application/json")
                        .execute()
                        .returnContent()
                        .asString(StandardCharsets.UTF_8);
            } catch (HttpResponseException e) {
                if (e.getStatusCode() == 401 || e.getStatusCode() == 403) {
                    logger.warn("intervals.icu {}: check INTERVALS_ATHLETE_ID and INTERVALS_API_KEY.", e.getStatusCode());
                }
                logger.error("Error executing request to {}: {} {}", url, e.getStatusCode(), e.getReasonPhrase());
                throw e;
            }
        }, IntervalsHttpClient::isRetryable);
    }

    /**
     * Client errors are final, except request timeouts and rate limiting.
     */
    static boolean isRetryable(Exception e) {
        if (e instanceof HttpResponseException response) {
            int status = response.getStatusCode();
            return status >= 500 || status == 408 || status == 429;
        }
        return e instanceof IOException;
    }

    private String authorization() {
        String credentials = "API_KEY:" + apiKey;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String range(LocalDate oldest, LocalDate newest) {
        return "?oldest=" + oldest + "&newest=" + newest;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
