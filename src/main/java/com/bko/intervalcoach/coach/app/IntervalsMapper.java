package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.curve.AthleteReadings;
import com.bko.intervalcoach.curve.PowerCurve;
import com.bko.intervalcoach.fitness.LoadSample;
import com.bko.intervalcoach.integrations.intervals.IntervalsActivity;
import com.bko.intervalcoach.integrations.intervals.IntervalsAthlete;
import com.bko.intervalcoach.integrations.intervals.IntervalsEvent;
import com.bko.intervalcoach.integrations.intervals.IntervalsPowerCurve;
import com.bko.intervalcoach.integrations.intervals.IntervalsWellness;
import com.bko.intervalcoach.workout.EventPriority;
import com.bko.intervalcoach.workout.GoalEvent;
import com.bko.intervalcoach.workout.WellnessReading;
import com.bko.intervalcoach.zones.SessionZoneTimes;
import com.bko.intervalcoach.zones.Zone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Converts intervals.icu payloads into domain inputs. Records with unusable dates or values are skipped.
 */
final class IntervalsMapper {
    private static final Logger logger = LoggerFactory.getLogger(IntervalsMapper.class);

    private IntervalsMapper() {
    }

    static List<LoadSample> toLoadSamples(List<IntervalsActivity> activities) {
        List<LoadSample> samples = new ArrayList<>();
        for (IntervalsActivity activity : nullSafe(activities)) {
            LocalDate date = parseDate(activity.getStartDateLocal());
            Double load = activity.getIcuTrainingLoad();
            if (date == null || load == null || load.isNaN() || load.isInfinite() || load < 0) {
                continue;
            }
            samples.add(new LoadSample(date, load));
        }
        return samples;
    }

    static List<SessionZoneTimes> toSessions(List<IntervalsActivity> activities) {
        List<SessionZoneTimes> sessions = new ArrayList<>();
        for (IntervalsActivity activity : nullSafe(activities)) {
            LocalDate date = parseDate(activity.getStartDateLocal());
            if (date == null || activity.getIcuZoneTimes() == null || activity.getIcuZoneTimes().isEmpty()) {
                continue;
            }
            Map<Zone, Integer> secondsByZone = new EnumMap<>(Zone.class);
            for (IntervalsActivity.ZoneTime zoneTime : activity.getIcuZoneTimes()) {
                zone(zoneTime.getId()).ifPresent(zone -> {
                    if (zoneTime.getSecs() != null) {
                        secondsByZone.merge(zone, zoneTime.getSecs(), Integer::sum);
                    }
                });
            }
            int movingTime = activity.getMovingTime() != null
                    ? activity.getMovingTime()
                    : secondsByZone.values().stream().mapToInt(Integer::intValue).sum();
            double load = activity.getIcuTrainingLoad() != null ? activity.getIcuTrainingLoad() : 0.0;
            sessions.add(new SessionZoneTimes(activity.getId(), date, movingTime, secondsByZone, load));
        }
        return sessions;
    }

    static List<WellnessReading> toWellness(List<IntervalsWellness> records) {
        List<WellnessReading> readings = new ArrayList<>();
        for (IntervalsWellness record : nullSafe(records)) {
            LocalDate date = parseDate(record.getId());
            if (date == null) {
                continue;
            }
            Double sleepHours = record.getSleepSecs() != null ? record.getSleepSecs() / 3600.0 : null;
            readings.add(new WellnessReading(date, record.getHrv(), record.getRestingHR(),
                    sleepHours, record.getSleepScore(), record.getReadiness()));
        }
        return readings;
    }

    static List<GoalEvent> toGoalEvents(List<IntervalsEvent> events) {
        List<GoalEvent> goals = new ArrayList<>();
        for (IntervalsEvent event : nullSafe(events)) {
            LocalDate date = parseDate(event.getStartDateLocal());
            Optional<EventPriority> priority = EventPriority.parse(event.getCategory());
            if (date == null || priority.isEmpty()) {
                continue;
            }
            goals.add(new GoalEvent(date, priority.get(), event.getName(), event.getDescription()));
        }
        return goals;
    }

    /**
     * The first curve is the recent window; a second curve, when present, is the current season.
     */
    static AthleteReadings toReadings(IntervalsAthlete athlete, List<IntervalsPowerCurve> curves) {
        Double weight = athlete != null ? athlete.getIcuWeight() : null;
        Double manual = athlete != null ? athlete.manualFtp() : null;
        IntervalsPowerCurve recent = curves != null && !curves.isEmpty() ? curves.get(0) : null;
        IntervalsPowerCurve season = curves != null && curves.size() > 1 ? curves.get(1) : null;
        return new AthleteReadings(
                weight,
                manual,
                recent != null ? recent.eftp() : null,
                season != null ? season.eftp() : null,
                recent != null ? recent.wPrime() : null);
    }

    static PowerCurve toPowerCurve(List<IntervalsPowerCurve> curves) {
        if (curves == null || curves.isEmpty()) {
            return PowerCurve.empty();
        }
        IntervalsPowerCurve recent = curves.get(0);
        Map<Integer, Double> bests = new HashMap<>();
        int points = Math.min(recent.secs().size(), recent.watts().size());
        for (int i = 0; i < points; i++) {
            Integer secs = recent.secs().get(i);
            Double watts = recent.watts().get(i);
            if (secs != null && secs > 0 && watts != null && watts > 0) {
                bests.merge(secs, watts, Math::max);
            }
        }
        return PowerCurve.normalize(bests);
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            logger.debug("Skipping record with unparseable date {}", value);
            return null;
        }
    }

    private static Optional<Zone> zone(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Zone.fromLabel(id));
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring unknown zone id {}", id);
            return Optional.empty();
        }
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values == null ? List.of() : values;
    }
}
