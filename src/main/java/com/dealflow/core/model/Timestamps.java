package com.dealflow.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Reads the timestamps worker agents put into deals and messages.
 * <p>
 * Accepts {@link Instant}s, epoch milliseconds, and ISO-8601 date-times with either a
 * {@code T} or a space between date and time, with or without an offset. Zone-less
 * values are taken as UTC. Anything else yields {@code null} and a warning, so one
 * malformed deal never stops a supervisor tick.
 */
final class Timestamps {

    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    private static final DateTimeFormatter AGENT_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private Timestamps() {}

    static Instant parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant i) {
            return i;
        }
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        if (raw instanceof String s) {
            return s.isBlank() ? null : parseText(s.trim());
        }
        log.warn("Ignoring timestamp of unsupported type {}", raw.getClass().getName());
        return null;
    }

    private static Instant parseText(String text) {
        try {
            TemporalAccessor parsed = AGENT_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp '{}': {}", text, e.getMessage());
            return null;
        }
    }
}
