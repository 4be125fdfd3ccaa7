package com.example.flowscope.util;

import java.time.Clock;
import java.time.Instant;

public final class EpochSeconds {

    private EpochSeconds() {}

    public static double now(Clock clock) {
        return of(clock.instant());
    }

    public static double of(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
