package com.agropulse.collectors.extract;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PublishedDateParser {
    static final Pattern DATE_PATTERN = Pattern.compile("(\\d{2}/\\d{2}/\\d{4})");
    private static final Pattern DATE_TIME_PATTERN = Pattern.compile("(\\d{2}/\\d{2}/\\d{4}).*?(\\d{2}:\\d{2})");
    private static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ofPattern("dd/MM/uuuu");
    private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm");
    private static final DateTimeFormatter COMPACT_OFFSET = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssZ");

    private final ZoneId zone;
    private final List<Function<String, Instant>> machineParsers;

    public PublishedDateParser(ZoneId zone) {
        this.zone = zone;
        this.machineParsers = List.of(
                Instant::parse,
                value -> OffsetDateTime.parse(value).toInstant(),
                value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
                value -> OffsetDateTime.parse(value, COMPACT_OFFSET).toInstant(),
                value -> LocalDateTime.parse(value).atZone(zone).toInstant(),
                value -> LocalDate.parse(value).atStartOfDay(zone).toInstant()
        );
    }

    public Optional<Instant> parseMachine(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return machineParsers.stream()
                .map(parser -> safelyParse(parser, trimmed))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public Optional<Instant> parseLocalText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher dateTime = DATE_TIME_PATTERN.matcher(text);
        if (dateTime.find()) {
            Optional<Instant> combined = combine(dateTime.group(1), dateTime.group(2));
            if (combined.isPresent()) {
                return combined;
            }
        }
        Matcher date = DATE_PATTERN.matcher(text);
        if (date.find()) {
            return combine(date.group(1), null);
        }
        return Optional.empty();
    }

    /**
     * A listing date heading plus an optional {@code HH:mm} time; an unusable time
     * falls back to the start of the day.
     */
    public Optional<Instant> combine(String date, String time) {
        if (time != null && !time.isBlank()) {
            Optional<Instant> withTime = safelyParse(
                    value -> LocalDateTime.parse(value, LOCAL_DATE_TIME).atZone(zone).toInstant(),
                    date.trim() + " " + time.trim()
            );
            if (withTime.isPresent()) {
                return withTime;
            }
        }
        return safelyParse(value -> LocalDate.parse(value, LOCAL_DATE).atStartOfDay(zone).toInstant(), date.trim());
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
