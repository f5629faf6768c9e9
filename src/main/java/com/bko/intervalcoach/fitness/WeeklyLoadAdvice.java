package com.bko.intervalcoach.fitness;

import com.bko.intervalcoach.advisory.AdvisorySource;

/**
 * @param targetWeeklyLoad total training stress to aim for over the next seven days
 * @param rampPerWeek      intended change of the long average per week
 */
public record WeeklyLoadAdvice(double targetWeeklyLoad, double rampPerWeek, String rationale, AdvisorySource source) {
}
