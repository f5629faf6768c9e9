package com.bko.intervalcoach.zones;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Infers the dominant zone and training stimulus of a session from its time-in-zone distribution.
 */
@Component
public class ZoneExposureClassifier {
    private static final Logger logger = LoggerFactory.getLogger(ZoneExposureClassifier.class);

    private final Thresholds thresholds;

    public ZoneExposureClassifier() {
        this(Thresholds.DEFAULTS);
    }

    public ZoneExposureClassifier(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    public Optional<ZoneExposure> classify(SessionZoneTimes session) {
        if (session == null || session.movingTimeSeconds() < thresholds.minMovingSeconds()) {
            return Optional.empty();
        }

        int total = 0;
        Zone dominant = Zone.Z1;
        int dominantSeconds = -1;
        for (Zone zone : Zone.values()) {
            int seconds = session.seconds(zone);
            total += seconds;
            // strict comparison: on a tie the easier zone, visited first, is kept
            if (seconds > dominantSeconds) {
                dominant = zone;
                dominantSeconds = seconds;
            }
        }

        Stimulus stimulus = inferStimulus(session, total);
        logger.debug("Session {} on {}: dominant {} stimulus {}", session.sessionId(), session.date(), dominant, stimulus);
        return Optional.of(new ZoneExposure(
                session.sessionId(),
                session.date(),
                session.secondsByZone(),
                total,
                dominant,
                stimulus,
                session.load()));
    }

    private Stimulus inferStimulus(SessionZoneTimes session, int total) {
        int z1 = session.seconds(Zone.Z1);
        int z2 = session.seconds(Zone.Z2);
        int z3 = session.seconds(Zone.Z3);
        int sweetSpot = session.seconds(Zone.SWEET_SPOT);
        int z4 = session.seconds(Zone.Z4);
        int highIntensity = session.seconds(Zone.Z5) + session.seconds(Zone.Z6) + session.seconds(Zone.Z7);

        if (highIntensity > thresholds.vo2maxSeconds()) {
            return Stimulus.VO2MAX;
        }
        if (z4 + sweetSpot > thresholds.thresholdSeconds()) {
            return Stimulus.THRESHOLD;
        }
        if (sweetSpot > thresholds.sweetSpotSeconds()) {
            return Stimulus.SWEETSPOT;
        }
        if (z3 > z2 / 2.0) {
            return Stimulus.TEMPO;
        }
        if (z2 + z3 > total / 2.0) {
            return Stimulus.ENDURANCE;
        }
        if (z1 > total / 2.0) {
            return Stimulus.RECOVERY;
        }
        return Stimulus.ENDURANCE;
    }

    public record Thresholds(int minMovingSeconds, int vo2maxSeconds, int thresholdSeconds, int sweetSpotSeconds) {
        public static final Thresholds DEFAULTS = new Thresholds(600, 300, 600, 300);
    }
}
