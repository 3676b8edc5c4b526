package com.plotline.engine;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Run identifiers: UTC timestamp plus a short random suffix, e.g. {@code 20240611_140502_3fa1}.
 * Sorting run ids lexically sorts them by start time.
 */
public final class RunIds {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private RunIds() {
    }

    public static String next() {
        return next(Clock.systemUTC());
    }

    public static String next(Clock clock) {
        return FORMAT.format(clock.instant()) + "_" + UUID.randomUUID().toString().substring(0, 4);
    }
}
