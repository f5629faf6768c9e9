package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.curve.AthleteReadings;
import com.bko.intervalcoach.fitness.LoadSample;
import com.bko.intervalcoach.integrations.intervals.IntervalsActivity;
import com.bko.intervalcoach.integrations.intervals.IntervalsEvent;
import com.bko.intervalcoach.integrations.intervals.IntervalsPowerCurve;
import com.bko.intervalcoach.integrations.intervals.IntervalsWellness;
import com.bko.intervalcoach.workout.EventPriority;
import com.bko.intervalcoach.workout.GoalEvent;
import com.bko.intervalcoach.workout.WellnessReading;
import com.bko.intervalcoach.zones.SessionZoneTimes;
import com.bko.intervalcoach.zones.Zone;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalsMapperTest {

    @Test
    void skipsActivitiesWithoutUsableLoadOrDate() {
        IntervalsActivity valid = activity("2025-03-01T08:00:00", 75.0);
        IntervalsActivity noLoad = activity("2025-03-02T08:00:00", null);
        IntervalsActivity badDate = activity("03/02/2025", 50.0);
        IntervalsActivity negative = activity("2025-03-03T08:00:00", -4.0);

        List<LoadSample> samples = IntervalsMapper.toLoadSamples(List.of(valid, noLoad, badDate, negative));

        assertEquals(List.of(new LoadSample(LocalDate.of(2025, 3, 1), 75.0)), samples);
    }

    @Test
    void mapsZoneTimesAndIgnoresUnknownZones() {
        IntervalsActivity ride = activity("2025-03-01T08:00:00", 80.0);
        ride.setId("i77");
        ride.setIcuZoneTimes(List.of(
                new IntervalsActivity.ZoneTime("Z2", 2400),
                new IntervalsActivity.ZoneTime("SS", 900),
                new IntervalsActivity.ZoneTime("Z9", 300)));

        List<SessionZoneTimes> sessions = IntervalsMapper.toSessions(List.of(ride, activity("2025-03-02T08:00:00", 20.0)));

        assertEquals(1, sessions.size());
        SessionZoneTimes session = sessions.get(0);
        assertEquals("i77", session.sessionId());
        assertEquals(2400, session.seconds(Zone.Z2));
        assertEquals(900, session.seconds(Zone.SWEET_SPOT));
        assertEquals(3300, session.movingTimeSeconds());
    }

    @Test
    void convertsSleepSecondsToHours() {
        IntervalsWellness wellness = new IntervalsWellness();
        wellness.setId("2025-03-01");
        wellness.setHrv(62.0);
        wellness.setSleepSecs(27000);

        WellnessReading reading = IntervalsMapper.toWellness(List.of(wellness)).get(0);

        assertEquals(LocalDate.of(2025, 3, 1), reading.date());
        assertEquals(7.5, reading.sleepHours());
        assertEquals(62.0, reading.hrv());
    }

    @Test
    void keepsOnlyRaceEventsAsGoals() {
        IntervalsEvent race = new IntervalsEvent();
        race.setCategory("RACE_B");
        race.setName("Spring classic");
        race.setStartDateLocal("2025-04-12T00:00:00");
        IntervalsEvent workout = new IntervalsEvent();
        workout.setCategory("WORKOUT");
        workout.setStartDateLocal("2025-04-13T00:00:00");

        List<GoalEvent> goals = IntervalsMapper.toGoalEvents(List.of(race, workout));

        assertEquals(1, goals.size());
        assertEquals(EventPriority.B, goals.get(0).priority());
        assertEquals(LocalDate.of(2025, 4, 12), goals.get(0).date());
    }

    @Test
    void readsRecentAndSeasonCurves() {
        IntervalsPowerCurve recent = new IntervalsPowerCurve("42d", List.of(5, 60), List.of(900.0, 420.0), 265.0, 18500.0);
        IntervalsPowerCurve season = new IntervalsPowerCurve("s0", List.of(), List.of(), 281.0, null);

        AthleteReadings readings = IntervalsMapper.toReadings(null, List.of(recent, season));

        assertEquals(265.0, readings.estimatedThreshold());
        assertEquals(281.0, readings.seasonBestThreshold());
        assertEquals(18500.0, readings.anaerobicCapacity());
        assertNull(readings.weightKg());
        assertTrue(IntervalsMapper.toPowerCurve(List.of(recent)).peakAt(60).isPresent());
    }

    private static IntervalsActivity activity(String start, Double load) {
        IntervalsActivity activity = new IntervalsActivity();
        activity.setStartDateLocal(start);
        activity.setIcuTrainingLoad(load);
        return activity;
    }
}
