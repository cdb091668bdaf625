package com.instorm.scorecard.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reads a calendar date from the API. Visit dates arrive either as plain dates or
 * as full ISO-8601 timestamps.
 *
 * Examples accepted:
 * - 2026-01-27
 * - 2026-01-27T09:30:00
 * - 2026-01-27T09:30:00.000Z
 * - 2026-01-27T09:30:00+02:00
 */
public final class LenientLocalDateDeserializer extends JsonDeserializer<LocalDate> {

    @Override
    public LocalDate deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String raw = p.getValueAsString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.trim();

        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException ignored) {
            // not a plain date
        }

        try {
            return OffsetDateTime.parse(s).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // no offset
        }

        try {
            return LocalDateTime.parse(s).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through
        }

        return (LocalDate) ctxt.handleWeirdStringValue(
                LocalDate.class,
                s,
                "Invalid visit date; expected ISO-8601 date or timestamp"
        );
    }
}
