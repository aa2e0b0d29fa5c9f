package com.moreremesas.sdk.auth;

import com.moreremesas.sdk.internal.Redaction;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Access token issued by the authentication endpoint.
 */
public final class Token {

    private final String accessToken;
    private final Instant expiry;
    private final String dueDate;

    public Token(String accessToken, Instant expiry, String dueDate) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
        this.expiry = expiry;
        this.dueDate = dueDate;
    }

    /**
     * Builds a token from the raw {@code AccessToken} and {@code DueDate} texts of an authentication response.
     */
    public static Token issued(String accessToken, String dueDate) {
        return new Token(accessToken == null ? "" : accessToken, parseDueDate(dueDate), dueDate);
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * @return the expiry instant, or {@code null} when the vendor sent no usable {@code DueDate}.
     */
    public Instant getExpiry() {
        return expiry;
    }

    public String getDueDate() {
        return dueDate;
    }

    /**
     * A token is expired from its expiry instant onwards. A token without a known expiry is always expired.
     */
    public boolean isExpired(Instant now) {
        return expiry == null || !now.isBefore(expiry);
    }

    /**
     * Parses a vendor {@code DueDate}. Offset and zoned date-times keep their zone; local date-times (with a
     * {@code T} or a space separator) are read as UTC; a bare date means the start of that day in UTC.
     *
     * @return the instant, or {@code null} when the text is blank or in none of those forms.
     */
    public static Instant parseDueDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        try {
            return ZonedDateTime.parse(value, DateTimeFormatter.ISO_ZONED_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a zoned date-time
        }
        try {
            return LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "Token{accessToken=" + Redaction.redact(accessToken) + ", expiry=" + expiry + "}";
    }
}
