package com.bko.intervalcoach.zones;

import com.bko.intervalcoach.shared.ProgressionSettings;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Keeps the levels of recent scoring runs so the next run can detect plateaus.
 * At most {@code plateauRetentionRuns} runs are kept, and runs older than
 * {@code plateauRetentionDays} are dropped. A rerun on the same date replaces the earlier run.
 */
@Component
public class ProgressionHistory {
    private final ProgressionSettings settings;
    private final Deque<Run> runs = new ArrayDeque<>();

    public ProgressionHistory(ProgressionSettings settings) {
        this.settings = settings;
    }

    /**
     * Levels of the retained runs strictly before {@code asOf}, newest first.
     */
    public synchronized Map<ProgressionCategory, List<Double>> priorLevels(LocalDate asOf) {
        Map<ProgressionCategory, List<Double>> levels = new EnumMap<>(ProgressionCategory.class);
        for (Run run : runs) {
            if (!run.date().isBefore(asOf) || DAYS.between(run.date(), asOf) > settings.plateauRetentionDays()) {
                continue;
            }
            run.levels().forEach((category, level) ->
                    levels.computeIfAbsent(category, c -> new ArrayList<>()).add(level));
        }
        return levels;
    }

    public synchronized void record(LocalDate asOf, Map<ProgressionCategory, ZoneProgression> progressions) {
        Map<ProgressionCategory, Double> levels = new EnumMap<>(ProgressionCategory.class);
        progressions.forEach((category, progression) -> levels.put(category, progression.level()));

        runs.removeIf(run -> run.date().equals(asOf));
        runs.addFirst(new Run(asOf, Map.copyOf(levels)));
        while (runs.size() > settings.plateauRetentionRuns()) {
            runs.removeLast();
        }
        Iterator<Run> iterator = runs.iterator();
        while (iterator.hasNext()) {
            if (DAYS.between(iterator.next().date(), asOf) > settings.plateauRetentionDays()) {
                iterator.remove();
            }
        }
    }

    private record Run(LocalDate date, Map<ProgressionCategory, Double> levels) {
    }
}
