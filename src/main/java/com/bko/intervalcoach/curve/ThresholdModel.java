package com.bko.intervalcoach.curve;

/**
 * Source of a threshold estimate, in the order the analyzer tries them.
 */
public enum ThresholdModel {
    PROVIDER_ESTIMATE,
    CRITICAL_POWER,
    TWENTY_MINUTE,
    MANUAL,
    NONE
}
