package com.bko.intervalcoach.advisory;

public enum AdvisorySource {
    ORACLE, FALLBACK
}
