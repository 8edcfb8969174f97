package com.router.service.impl;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Prefixes goals with the current UTC date and time so that relative dates ("tomorrow",
 * "last week") can be resolved by the model.
 */
@Component
public class TemporalContext {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy", Locale.ENGLISH);

    private final Clock clock;

    public TemporalContext(Clock clock) {
        this.clock = clock;
    }

    public String stamp(String goal) {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        return "[Current date and time: " + TIMESTAMP.format(now) + " UTC (" + LONG_DATE.format(now) + ")]\n\n" + goal;
    }
}
