package com.auditeng.backend.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from semantic field name (see {@link FieldNames}) to extracted field.
 */
@EqualsAndHashCode
@ToString
public final class NormalizedExtraction {

    private static final NormalizedExtraction EMPTY = new NormalizedExtraction(Map.of());

    /** ISO date-time with an offset written as Z, +hh:mm or +hhmm. */
    private static final DateTimeFormatter ZONED_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private final Map<String, ExtractedField<?>> fields;

    private NormalizedExtraction(Map<String, ExtractedField<?>> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static NormalizedExtraction empty() {
        return EMPTY;
    }

    public static NormalizedExtraction of(Map<String, ExtractedField<?>> fields) {
        return fields == null || fields.isEmpty() ? EMPTY : new NormalizedExtraction(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ExtractedField<?>> asMap() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public ExtractedField<?> get(String name) {
        ExtractedField<?> field = fields.get(name);
        return field != null ? field : ExtractedField.notFound("not extracted");
    }

    public boolean has(String name) {
        return get(name).isPresent();
    }

    public Optional<String> text(String name) {
        Object value = get(name).getValue();
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public Optional<Double> number(String name) {
        Object value = get(name).getValue();
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Double.parseDouble(text.trim().replace(',', '.')));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<Boolean> flag(String name) {
        Object value = get(name).getValue();
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a date field as a UTC calendar date. Accepts plain ISO dates and ISO date-times.
     */
    public Optional<LocalDate> date(String name) {
        return text(name).flatMap(NormalizedExtraction::parseDate);
    }

    /**
     * The single date reader shared by extraction and evaluation. A date-time may use either
     * {@code 'T'} or a space as separator; a zoned value is converted to its UTC date, and a
     * value whose zone cannot be read falls back to its leading {@code YYYY-MM-DD}.
     */
    public static Optional<LocalDate> parseDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.length() <= 10) {
            return parseLocalDate(value);
        }
        if (value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11).trim();
        }
        String calendarPart = value.substring(0, 10);
        if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:?\\d{2}$")) {
            return parseZoned(value).or(() -> parseLocalDate(calendarPart));
        }
        return parseLocalDate(calendarPart);
    }

    private static Optional<LocalDate> parseZoned(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value, ZONED_DATE_TIME)
                    .atZoneSameInstant(ZoneOffset.UTC).toLocalDate());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseLocalDate(String value) {
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Combines two extractions field by field, keeping the higher-confidence value.
     * On equal confidence the value already in this extraction wins.
     */
    public NormalizedExtraction merge(NormalizedExtraction other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, ExtractedField<?>> merged = new LinkedHashMap<>(fields);
        other.fields.forEach((name, candidate) -> {
            ExtractedField<?> current = merged.get(name);
            if (current == null || (!current.isPresent() && candidate.isPresent())
                    || candidate.getConfidence() > current.getConfidence()) {
                merged.put(name, candidate);
            }
        });
        return of(merged);
    }

    public NormalizedExtraction with(String name, ExtractedField<?> field) {
        Map<String, ExtractedField<?>> copy = new LinkedHashMap<>(fields);
        copy.put(name, field);
        return of(copy);
    }

    /**
     * Mean confidence of the fields that carry a value, 0 when none do.
     */
    public double averageConfidence() {
        return fields.values().stream()
                .filter(ExtractedField::isPresent)
                .mapToDouble(ExtractedField::getConfidence)
                .average()
                .orElse(0.0);
    }

    public static final class Builder {
        private final Map<String, ExtractedField<?>> fields = new LinkedHashMap<>();

        public Builder field(String name, ExtractedField<?> field) {
            fields.put(name, field);
            return this;
        }

        public NormalizedExtraction build() {
            return of(fields);
        }
    }
}
