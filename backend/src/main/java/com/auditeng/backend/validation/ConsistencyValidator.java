package com.auditeng.backend.validation;

import com.auditeng.backend.model.Inconsistency;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.rules.CalibrationDates;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Cross-checks values that several documents of one report must agree on.
 * <p>
 * Checks run most critical first and each reports at most one inconsistency. A check with
 * fewer than two comparable sources is skipped.
 */
@Component
public class ConsistencyValidator {

    public static final String CERTIFICATE_EXPIRED = "CERT-001";
    public static final String TAG_MISMATCH = "TAG-001";
    public static final String TEMPERATURE_MISMATCH = "TEMP-001";
    public static final String SERIAL_MISMATCH = "SERIAL-001";
    public static final String DISPLAY_MISMATCH = "VALUE-001";

    static final double MAX_TEMPERATURE_DIFFERENCE = 1.0;
    static final double DISPLAY_TOLERANCE = 0.05;

    public List<Inconsistency> validate(ConsolidatedEvidence evidence) {
        List<Inconsistency> inconsistencies = new ArrayList<>();
        checkCertificateExpiry(evidence).ifPresent(inconsistencies::add);
        checkIdentifier(evidence, EQUIPMENT_TAG, TAG_MISMATCH, "Equipment TAG", ConsistencyValidator::normalizeTag,
                EvidenceSource.REPORT, EvidenceSource.PHOTO, EvidenceSource.DATA_TABLE)
                .ifPresent(inconsistencies::add);
        if (evidence.testType() == TestType.THERMOGRAPHY) {
            checkTemperatures(evidence).ifPresent(inconsistencies::add);
        }
        checkIdentifier(evidence, INSTRUMENT_SERIAL, SERIAL_MISMATCH, "Instrument serial number",
                ConsistencyValidator::normalizeSerial,
                EvidenceSource.CERTIFICATE, EvidenceSource.REPORT, EvidenceSource.PHOTO, EvidenceSource.INSTRUMENT)
                .ifPresent(inconsistencies::add);
        checkDisplayValue(evidence).ifPresent(inconsistencies::add);
        return inconsistencies;
    }

    private Optional<Inconsistency> checkCertificateExpiry(ConsolidatedEvidence evidence) {
        Optional<LocalDate> expiry = evidence.get(EvidenceSource.CERTIFICATE).date(CALIBRATION_EXPIRY_DATE);
        Optional<LocalDate> measured = evidence.get(EvidenceSource.REPORT).date(MEASUREMENT_DATE);
        if (expiry.isEmpty() || measured.isEmpty()) {
            return Optional.empty();
        }
        if (!CalibrationDates.isExpired(expiry.get(), measured.get())) {
            return Optional.empty();
        }
        return Optional.of(Inconsistency.builder()
                .code(CERTIFICATE_EXPIRED)
                .severity(Severity.CRITICAL)
                .field(CALIBRATION_EXPIRY_DATE)
                .expected("on or after " + measured.get())
                .found(expiry.get().toString())
                .message("Calibration certificate expired on " + expiry.get()
                        + ", before the measurement on " + measured.get())
                .build());
    }

    /**
     * Every document of every listed source is a candidate, so two photos that disagree are
     * reported just like a photo that disagrees with the report.
     */
    private Optional<Inconsistency> checkIdentifier(ConsolidatedEvidence evidence, String field, String code,
            String label, UnaryOperator<String> normalizer, EvidenceSource... sources) {
        Map<String, String> raw = new LinkedHashMap<>();
        for (EvidenceSource source : sources) {
            List<NormalizedExtraction> documents = evidence.documents(source);
            for (int i = 0; i < documents.size(); i++) {
                String candidate = documents.size() > 1 ? source.label() + " " + (i + 1) : source.label();
                documents.get(i).text(field)
                        .filter(value -> !normalizer.apply(value).isEmpty())
                        .ifPresent(value -> raw.put(candidate, value));
            }
        }
        if (raw.size() < 2) {
            return Optional.empty();
        }
        String reference = null;
        String referenceRaw = null;
        for (String value : raw.values()) {
            String normalized = normalizer.apply(value);
            if (reference == null) {
                reference = normalized;
                referenceRaw = value;
            } else if (!reference.equals(normalized)) {
                return Optional.of(Inconsistency.builder()
                        .code(code)
                        .severity(Severity.CRITICAL)
                        .field(field)
                        .expected(referenceRaw)
                        .found(value)
                        .message(label + " differs between sources: " + describe(raw))
                        .build());
            }
        }
        return Optional.empty();
    }

    private Optional<Inconsistency> checkTemperatures(ConsolidatedEvidence evidence) {
        Optional<Double> ambient = firstNumber(evidence, AMBIENT_TEMPERATURE);
        Optional<Double> reflected = firstNumber(evidence, REFLECTED_TEMPERATURE);
        if (ambient.isEmpty() || reflected.isEmpty()) {
            return Optional.empty();
        }
        double difference = Math.abs(ambient.get() - reflected.get());
        if (difference <= MAX_TEMPERATURE_DIFFERENCE) {
            return Optional.empty();
        }
        return Optional.of(Inconsistency.builder()
                .code(TEMPERATURE_MISMATCH)
                .severity(Severity.CRITICAL)
                .field(REFLECTED_TEMPERATURE)
                .expected(String.format(Locale.ROOT, "within %.1f of ambient %.1f", MAX_TEMPERATURE_DIFFERENCE, ambient.get()))
                .found(String.format(Locale.ROOT, "%.1f", reflected.get()))
                .message(String.format(Locale.ROOT,
                        "Ambient (%.1f) and reflected (%.1f) temperatures differ by %.1f, more than %.1f",
                        ambient.get(), reflected.get(), difference, MAX_TEMPERATURE_DIFFERENCE))
                .build());
    }

    private Optional<Inconsistency> checkDisplayValue(ConsolidatedEvidence evidence) {
        Optional<Double> photo = evidence.get(EvidenceSource.PHOTO).number(DISPLAY_VALUE);
        Optional<Double> table = evidence.get(EvidenceSource.DATA_TABLE).number(TABLE_VALUE);
        if (photo.isEmpty() || table.isEmpty() || table.get() == 0.0) {
            return Optional.empty();
        }
        double relative = Math.abs(photo.get() - table.get()) / Math.abs(table.get());
        if (relative <= DISPLAY_TOLERANCE) {
            return Optional.empty();
        }
        return Optional.of(Inconsistency.builder()
                .code(DISPLAY_MISMATCH)
                .severity(Severity.MINOR)
                .field(DISPLAY_VALUE)
                .expected(String.valueOf(table.get()))
                .found(String.valueOf(photo.get()))
                .message(String.format(Locale.ROOT,
                        "Display value in photo (%s) differs from the data table (%s) by %.1f%%",
                        photo.get(), table.get(), relative * 100))
                .build());
    }

    private static Optional<Double> firstNumber(ConsolidatedEvidence evidence, String field) {
        Optional<Double> thermal = evidence.get(EvidenceSource.THERMAL_IMAGE).number(field);
        return thermal.isPresent() ? thermal : evidence.get(EvidenceSource.REPORT).number(field);
    }

    private static String describe(Map<String, String> raw) {
        return raw.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }

    /** Uppercase, trimmed, runs of whitespace, hyphens and underscores collapsed to one hyphen. */
    static String normalizeTag(String tag) {
        return tag.toUpperCase(Locale.ROOT).trim().replaceAll("[\\s\\-_]+", "-");
    }

    /** Uppercase with whitespace, hyphens, underscores and periods removed. */
    static String normalizeSerial(String serial) {
        return serial.toUpperCase(Locale.ROOT).replaceAll("[\\s\\-_.]", "");
    }
}
