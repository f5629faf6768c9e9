package com.bko.intervalcoach.coach.app;

import com.bko.intervalcoach.integrations.intervals.IntervalsActivity;
import com.bko.intervalcoach.integrations.intervals.IntervalsAthlete;
import com.bko.intervalcoach.integrations.intervals.IntervalsClientPort;
import com.bko.intervalcoach.integrations.intervals.IntervalsPowerCurve;
import com.bko.intervalcoach.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Fetches everything a run needs from intervals.icu. Each fetch fails independently: a failed
 * fetch leaves its part empty and adds a warning, so the run continues from cold-start inputs.
 */
@Component
public class AthleteDataLoader {
    private static final Logger logger = LoggerFactory.getLogger(AthleteDataLoader.class);
    static final int WELLNESS_DAYS = 14;
    static final int EVENT_DAYS = 365;

    private final IntervalsClientPort intervalsClient;
    private final AppSettings settings;

    public AthleteDataLoader(IntervalsClientPort intervalsClient, AppSettings settings) {
        this.intervalsClient = intervalsClient;
        this.settings = settings;
    }

    public AthleteData load(LocalDate today, RunDiagnostics diagnostics) {
        if (!settings.isIntervalsConfigured()) {
            diagnostics.warn("intervals.icu credentials missing. Check INTERVALS_ATHLETE_ID and INTERVALS_API_KEY; using cold-start defaults.");
            return AthleteData.empty();
        }
        return fetchAll(today, diagnostics);
    }

    private AthleteData fetchAll(LocalDate today, RunDiagnostics diagnostics) {
        LocalDate oldest = today.minusDays(settings.coach().historyDays() - 1L);
        List<IntervalsActivity> activities = fetch("activities",
                () -> intervalsClient.getActivities(oldest, today), List.of(), diagnostics);
        List<IntervalsPowerCurve> curves = fetch("power curves",
                intervalsClient::getPowerCurves, List.of(), diagnostics);
        IntervalsAthlete athlete = fetch("athlete profile",
                intervalsClient::getAthlete, null, diagnostics);

        AthleteData data = new AthleteData(
                IntervalsMapper.toLoadSamples(activities),
                IntervalsMapper.toSessions(activities),
                IntervalsMapper.toWellness(fetch("wellness",
                        () -> intervalsClient.getWellness(today.minusDays(WELLNESS_DAYS - 1L), today), List.of(), diagnostics)),
                IntervalsMapper.toGoalEvents(fetch("events",
                        () -> intervalsClient.getEvents(today.minusDays(1), today.plusDays(EVENT_DAYS)), List.of(), diagnostics)),
                IntervalsMapper.toReadings(athlete, curves),
                IntervalsMapper.toPowerCurve(curves));
        diagnostics.info("Loaded " + data.loads().size() + " activities, " + data.wellness().size()
                + " wellness days and " + data.events().size() + " goal events.");
        return data;
    }

    private <T> T fetch(String what, Fetch<T> call, T fallback, RunDiagnostics diagnostics) {
        try {
            T result = call.get();
            return result != null ? result : fallback;
        } catch (IOException | RuntimeException e) {
            logger.warn("Fetching {} from intervals.icu failed", what, e);
            diagnostics.warn("Fetching " + what + " failed: " + e.getMessage());
            return fallback;
        }
    }

    @FunctionalInterface
    private interface Fetch<T> {
        T get() throws IOException;
    }
}
