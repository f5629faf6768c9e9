package com.bko.intervalcoach.integrations.intervals;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to the athlete's intervals.icu data. Date ranges are inclusive.
 */
public interface IntervalsClientPort {
    List<IntervalsActivity> getActivities(LocalDate oldest, LocalDate newest) throws IOException;

    List<IntervalsWellness> getWellness(LocalDate oldest, LocalDate newest) throws IOException;

    List<IntervalsEvent> getEvents(LocalDate oldest, LocalDate newest) throws IOException;

    IntervalsAthlete getAthlete() throws IOException;

    /**
     * Cycling power curves; the first entry covers the recent window, the second the current season.
     */
    List<IntervalsPowerCurve> getPowerCurves() throws IOException;
}
