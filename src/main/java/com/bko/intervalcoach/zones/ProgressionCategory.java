package com.bko.intervalcoach.zones;

import java.util.EnumSet;
import java.util.Set;

/**
 * Physiological categories tracked by the progression scorer.
 * Baselines are minutes per 28 days that earn the full volume score.
 */
public enum ProgressionCategory {
    ENDURANCE(600, 20, EnumSet.of(Zone.Z2)),
    TEMPO(120, 10, EnumSet.of(Zone.Z3)),
    THRESHOLD(90, 10, EnumSet.of(Zone.SWEET_SPOT, Zone.Z4)),
    VO2MAX(45, 5, EnumSet.of(Zone.Z5)),
    ANAEROBIC(15, 2, EnumSet.of(Zone.Z6, Zone.Z7));

    private final double baselineMinutes;
    private final double minSessionMinutes;
    private final Set<Zone> zones;

    ProgressionCategory(double baselineMinutes, double minSessionMinutes, Set<Zone> zones) {
        this.baselineMinutes = baselineMinutes;
        this.minSessionMinutes = minSessionMinutes;
        this.zones = zones;
    }

    public double baselineMinutes() {
        return baselineMinutes;
    }

    public double minSessionMinutes() {
        return minSessionMinutes;
    }

    public double minutesIn(ZoneExposure exposure) {
        int seconds = 0;
        for (Zone zone : zones) {
            seconds += exposure.seconds(zone);
        }
        return seconds / 60.0;
    }
}
