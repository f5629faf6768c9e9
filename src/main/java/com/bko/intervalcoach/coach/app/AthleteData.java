package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.curve.AthleteReadings;
import com.bko.intervalcoach.curve.PowerCurve;
import com.bko.intervalcoach.fitness.LoadSample;
import com.bko.intervalcoach.workout.GoalEvent;
import com.bko.intervalcoach.workout.WellnessReading;
import com.bko.intervalcoach.zones.SessionZoneTimes;

import java.util.List;

/**
 * Provider data for one run, already mapped to domain types. Missing parts are empty, never null.
 */
public record AthleteData(
        List<LoadSample> loads,
        List<SessionZoneTimes> sessions,
        List<WellnessReading> wellness,
        List<GoalEvent> events,
        AthleteReadings readings,
        PowerCurve powerCurve
) {
    public AthleteData {
        loads = loads == null ? List.of() : List.copyOf(loads);
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
        wellness = wellness == null ? List.of() : List.copyOf(wellness);
        events = events == null ? List.of() : List.copyOf(events);
        readings = readings == null ? AthleteReadings.none() : readings;
        powerCurve = powerCurve == null ? PowerCurve.empty() : powerCurve;
    }

    public static AthleteData empty() {
        return new AthleteData(null, null, null, null, null, null);
    }
}
