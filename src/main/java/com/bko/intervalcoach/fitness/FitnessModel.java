package com.bko.intervalcoach.fitness;

import com.bko.intervalcoach.shared.FitnessSettings;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Exponentially weighted fitness/fatigue model.
 * Each calendar day applies {@code avg' = avg + (load - avg) / constant} to both averages;
 * days without training contribute a load of 0.
 */
@Component
public class FitnessModel {
    private final FitnessSettings settings;

    public FitnessModel(FitnessSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Fitness at the end of {@code asOf}, starting from zero averages the day before the first sample.
     */
    public FitnessState currentState(List<LoadSample> history, LocalDate asOf) {
        Objects.requireNonNull(asOf, "asOf");
        TreeMap<LocalDate, Double> daily = dailyTotals(history);
        if (daily.isEmpty() || daily.firstKey().isAfter(asOf)) {
            return FitnessState.coldStart(asOf);
        }
        FitnessState seed = FitnessState.coldStart(daily.firstKey().minusDays(1));
        return advance(seed, daily, asOf);
    }

    /**
     * Continues from {@code seed}; samples on or before the seed date are ignored.
     */
    public FitnessState currentState(FitnessState seed, List<LoadSample> history, LocalDate asOf) {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(asOf, "asOf");
        if (asOf.isBefore(seed.date())) {
            throw new IllegalArgumentException("asOf " + asOf + " is before the seed date " + seed.date());
        }
        return advance(seed, dailyTotals(history), asOf);
    }

    /**
     * Projects the averages {@code horizonDays} days past the seed date. Days missing from
     * {@code futureLoads} are treated as rest days. The result is an immutable list, so it can be
     * iterated any number of times.
     */
    public List<ProjectedDay> project(FitnessState seed, Map<LocalDate, Double> futureLoads, int horizonDays) {
        Objects.requireNonNull(seed, "seed");
        if (horizonDays < 0) {
            throw new IllegalArgumentException("Projection horizon must not be negative: " + horizonDays);
        }
        Map<LocalDate, Double> forecast = futureLoads == null ? Map.of() : futureLoads;
        forecast.forEach((date, load) -> {
            if (load == null || load < 0 || load.isNaN()) {
                throw new IllegalArgumentException("Planned load on " + date + " must be a non-negative number: " + load);
            }
        });

        List<ProjectedDay> days = new ArrayList<>(horizonDays);
        FitnessState state = seed;
        for (int i = 0; i < horizonDays; i++) {
            LocalDate date = state.date().plusDays(1);
            double load = forecast.getOrDefault(date, 0.0);
            state = step(state, load);
            days.add(new ProjectedDay(
                    date,
                    round(state.longAverage()),
                    round(state.shortAverage()),
                    round(state.form()),
                    round(load)));
        }
        return Collections.unmodifiableList(days);
    }

    /**
     * Applies one day of load to the given state.
     */
    public FitnessState step(FitnessState state, double load) {
        if (load < 0) {
            throw new IllegalArgumentException("Load must not be negative: " + load);
        }
        double longAverage = state.longAverage() + (load - state.longAverage()) / settings.longTimeConstant();
        double shortAverage = state.shortAverage() + (load - state.shortAverage()) / settings.shortTimeConstant();
        return new FitnessState(state.date().plusDays(1), Math.max(0.0, longAverage), Math.max(0.0, shortAverage));
    }

    static TreeMap<LocalDate, Double> dailyTotals(List<LoadSample> history) {
        TreeMap<LocalDate, Double> daily = new TreeMap<>();
        if (history == null) {
            return daily;
        }
        for (LoadSample sample : history) {
            daily.merge(sample.date(), sample.load(), Double::sum);
        }
        return daily;
    }

    private FitnessState advance(FitnessState seed, TreeMap<LocalDate, Double> daily, LocalDate asOf) {
        FitnessState state = seed;
        while (state.date().isBefore(asOf)) {
            LocalDate next = state.date().plusDays(1);
            state = step(state, daily.getOrDefault(next, 0.0));
        }
        return state;
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
