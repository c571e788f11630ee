package com.sem.lcs.api;

import java.util.Locale;

/**
 * Latent factor of one process. {@code time} is 0 for the time-free initial
 * factors.
 */
public record LatentVariable(LatentRole role, String process, int time) implements Variable {

    public LatentVariable {
        if (role == null || process == null)
            throw new IllegalArgumentException("role and process are required");
        if (role.isTimed() ? time < 1 : time != 0)
            throw new IllegalArgumentException("Bad occasion " + time + " for " + role);
    }

    public static LatentVariable level(String process) {
        return new LatentVariable(LatentRole.INITIAL_LEVEL, process, 0);
    }

    public static LatentVariable slope(String process) {
        return new LatentVariable(LatentRole.INITIAL_SLOPE, process, 0);
    }

    public static LatentVariable state(String process, int time) {
        return new LatentVariable(LatentRole.STATE, process, time);
    }

    public static LatentVariable change(String process, int time) {
        return new LatentVariable(LatentRole.CHANGE, process, time);
    }

    @Override
    public String name() {
        String p = process.toLowerCase(Locale.ROOT);
        return switch (role) {
            case INITIAL_LEVEL -> p + "0";
            case INITIAL_SLOPE -> p + "a";
            case STATE -> "l" + process + "_T" + time;
            case CHANGE -> "d" + process + "_T" + time;
        };
    }

    @Override
    public String toString() {
        return name();
    }
}
