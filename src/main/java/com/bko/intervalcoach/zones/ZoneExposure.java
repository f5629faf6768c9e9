package com.bko.intervalcoach.zones;

import java.time.LocalDate;
import java.util.Map;

/**
 * Classified time-in-zone distribution of a qualifying session.
 */
public record ZoneExposure(
        String sessionId,
        LocalDate date,
        Map<Zone, Integer> secondsByZone,
        int totalSeconds,
        Zone dominantZone,
        Stimulus stimulus,
        double load
) {
    public ZoneExposure {
        secondsByZone = Map.copyOf(secondsByZone);
    }

    public int seconds(Zone zone) {
        return secondsByZone.getOrDefault(zone, 0);
    }
}
