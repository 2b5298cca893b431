package com.aperture.query.time;

public enum IntervalUnit {
    SECOND(1),
    MINUTE(60),
    HOUR(3_600),
    DAY(86_400);

    private final long seconds;

    IntervalUnit(long seconds) {
        this.seconds = seconds;
    }

    public long getSeconds() {
        return seconds;
    }

    public static IntervalUnit fromString(String unit) {
        String normalized = unit.trim().toUpperCase(java.util.Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        try {
            return IntervalUnit.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported interval unit: " + unit, e);
        }
    }
}
