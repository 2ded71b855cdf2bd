package com.leadscore.utils.basic;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

public final class DefaultValuesPopulator {

    private static final DateTimeFormatter RUN_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private DefaultValuesPopulator() {
        throw new UnsupportedOperationException("Operation not supported");
    }

    public static LocalDateTime getCurrentTimestamp() {
        return LocalDateTime.now();
    }

    public static String getRunDate(Clock clock) {
        return LocalDate.now(clock).format(RUN_DATE);
    }

    public static String getUid() {
        return UUID.randomUUID().toString();
    }
}
