package com.bko.intervalcoach.zones;

/**
 * Intensity bands relative to threshold, declared from easiest to hardest.
 * The sweet-spot band sits between Z3 and Z4.
 */
public enum Zone {
    Z1, Z2, Z3, SWEET_SPOT, Z4, Z5, Z6, Z7;

    public static Zone fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Zone label is missing");
        }
        String normalized = label.trim().toUpperCase();
        if (normalized.equals("SS") || normalized.equals("SWEETSPOT") || normalized.equals("SWEET_SPOT")) {
            return SWEET_SPOT;
        }
        return Zone.valueOf(normalized);
    }
}
