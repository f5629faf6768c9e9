package com.bko.intervalcoach.workout;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Static table of workout types. Declaration order is the final tie-break of the fallback selector.
 */
public final class WorkoutCatalog {
    public static final String DEFAULT_RESOURCE = "catalog/workouts.json";

    private final Map<String, WorkoutCandidate> byTypeId;
    private final WorkoutCandidate easyDefault;
    private final WorkoutCandidate easyInjection;

    public WorkoutCatalog(List<WorkoutCandidate> workouts, String easyDefaultId, String easyInjectionId) {
        Map<String, WorkoutCandidate> map = new LinkedHashMap<>();
        for (WorkoutCandidate workout : workouts) {
            if (map.put(workout.typeId(), workout) != null) {
                throw new IllegalArgumentException("Duplicate workout type " + workout.typeId());
            }
        }
        this.byTypeId = map;
        this.easyDefault = require(easyDefaultId);
        this.easyInjection = require(easyInjectionId);
        if (easyDefault.intensity() > 2 || easyInjection.intensity() > 2) {
            throw new IllegalArgumentException("Easy catalog entries must have intensity 2 or lower");
        }
    }

    public static WorkoutCatalog load(ObjectMapper objectMapper) {
        return load(objectMapper, DEFAULT_RESOURCE);
    }

    public static WorkoutCatalog load(ObjectMapper objectMapper, String resource) {
        try (InputStream in = WorkoutCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Workout catalog resource not found: " + resource);
            }
            CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
            return new WorkoutCatalog(document.workouts(), document.easyDefault(), document.easyInjection());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read workout catalog " + resource, e);
        }
    }

    public List<WorkoutCandidate> all() {
        return List.copyOf(byTypeId.values());
    }

    public Optional<WorkoutCandidate> find(String typeId) {
        return Optional.ofNullable(typeId == null ? null : byTypeId.get(typeId));
    }

    public int indexOf(WorkoutCandidate candidate) {
        int index = 0;
        for (String typeId : byTypeId.keySet()) {
            if (typeId.equals(candidate.typeId())) {
                return index;
            }
            index++;
        }
        return Integer.MAX_VALUE;
    }

    /**
     * Returned when every entry is filtered out.
     */
    public WorkoutCandidate easyDefault() {
        return easyDefault;
    }

    /**
     * Added to the fallback candidates when no easy entry survives filtering.
     */
    public WorkoutCandidate easyInjection() {
        return easyInjection;
    }

    /**
     * One line per workout type, for the oracle prompt.
     */
    public String summary() {
        return byTypeId.values().stream()
                .map(w -> w.typeId() + ": " + w.name()
                        + " | intensity " + w.intensity()
                        + " | " + w.minDurationMinutes() + "-" + w.maxDurationMinutes() + " min"
                        + " | stimulus " + w.stimulus().id()
                        + " | phases " + w.phases())
                .collect(Collectors.joining("\n"));
    }

    private WorkoutCandidate require(String typeId) {
        WorkoutCandidate candidate = byTypeId.get(typeId);
        if (candidate == null) {
            throw new IllegalArgumentException("Catalog has no workout type " + typeId);
        }
        return candidate;
    }

    record CatalogDocument(String easyDefault, String easyInjection, List<WorkoutCandidate> workouts) {
    }
}
