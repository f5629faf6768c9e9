package com.bko.intervalcoach.zones;

public enum ProgressionTrend {
    IMPROVING, STABLE, DECLINING, PLATEAUED
}
