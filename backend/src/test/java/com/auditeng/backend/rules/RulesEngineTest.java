package com.auditeng.backend.rules;

import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.FieldNames;
import com.auditeng.backend.model.Inconsistency;
import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.PhaseCombination;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RulesEngineTest {

    private final RulesEngine engine = new RulesEngine(List.of(
            new GroundingRules(), new MeggerRules(), new ThermographyRules()));

    private static NormalizedExtraction.Builder fields(Object... nameValuePairs) {
        NormalizedExtraction.Builder builder = NormalizedExtraction.builder();
        for (int i = 0; i < nameValuePairs.length; i += 2) {
            builder.field((String) nameValuePairs[i], ExtractedField.of(nameValuePairs[i + 1], 0.9, "report"));
        }
        return builder;
    }

    private static List<String> codes(EvaluationResult result) {
        return result.getNonConformities().stream().map(NonConformity::getCode).toList();
    }

    @Test
    void shouldRejectGroundResistanceAboveLimit() {
        NormalizedExtraction extraction = fields(
                FieldNames.GROUND_RESISTANCE, 6.2,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        assertEquals(Verdict.REJECTED, result.getVerdict());
        assertEquals(List.of("GND-001"), codes(result));
        assertTrue(result.getScore() <= 59);
    }

    @Test
    void shouldApproveCompliantGroundingReport() {
        NormalizedExtraction extraction = fields(
                FieldNames.GROUND_RESISTANCE, 5.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        assertEquals(Verdict.APPROVED, result.getVerdict());
        assertTrue(result.getNonConformities().isEmpty());
        assertTrue(result.getScore() >= 85 && result.getScore() <= 100);
    }

    @Test
    void shouldRequireWatermarkAndSignatureForGrounding() {
        NormalizedExtraction extraction = fields(FieldNames.GROUND_RESISTANCE, 2.0).build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        assertEquals(Verdict.APPROVED_WITH_COMMENTS, result.getVerdict());
        assertEquals(List.of("GND-002", "GND-003"), codes(result));
        assertTrue(result.getScore() >= 60 && result.getScore() <= 84);
    }

    @Test
    void shouldNameMissingPhaseCombination() {
        NormalizedExtraction.Builder builder = fields(FieldNames.ABSORPTION_INDEX, 1.8);
        for (PhaseCombination combination : PhaseCombination.values()) {
            if (combination != PhaseCombination.B_G) {
                builder.field(combination.fieldName(), ExtractedField.of(500.0, 0.9, "report"));
            }
        }

        EvaluationResult result = engine.evaluate(TestType.MEGGER, builder.build(), List.of());

        assertEquals(Verdict.REJECTED, result.getVerdict());
        assertEquals(List.of("MEG-001"), codes(result));
        assertTrue(result.getNonConformities().get(0).getDescription().contains("B-G"));
        assertFalse(result.getNonConformities().get(0).getDescription().contains("A-B"));
    }

    @Test
    void shouldFlagLowInsulationAndAbsorption() {
        NormalizedExtraction.Builder builder = fields(FieldNames.ABSORPTION_INDEX, 1.2);
        for (PhaseCombination combination : PhaseCombination.values()) {
            builder.field(combination.fieldName(),
                    ExtractedField.of(combination == PhaseCombination.C_G ? 80.0 : 900.0, 0.9, "report"));
        }

        EvaluationResult result = engine.evaluate(TestType.MEGGER, builder.build(), List.of());

        assertEquals(List.of("MEG-002", "MEG-003"), codes(result));
        assertEquals(Severity.CRITICAL, result.getNonConformities().get(0).getSeverity());
        assertEquals(Severity.MAJOR, result.getNonConformities().get(1).getSeverity());
    }

    @Test
    void shouldClassifyThermographyDeltaT() {
        NormalizedExtraction.Builder complete = fields(
                FieldNames.LOAD_CURRENT, 120.0,
                FieldNames.LOAD_PERCENT, 65.0,
                FieldNames.REFLECTED_TEMPERATURE, 24.0);

        EvaluationResult critical = engine.evaluate(TestType.THERMOGRAPHY,
                complete.build().with(FieldNames.PHASE_DELTA_T, ExtractedField.of(15.5, 0.9, "report")), List.of());
        EvaluationResult attention = engine.evaluate(TestType.THERMOGRAPHY,
                complete.build().with(FieldNames.PHASE_DELTA_T, ExtractedField.of(15.0, 0.9, "report")), List.of());
        EvaluationResult normal = engine.evaluate(TestType.THERMOGRAPHY,
                complete.build().with(FieldNames.PHASE_DELTA_T, ExtractedField.of(3.0, 0.9, "report")), List.of());

        assertEquals(List.of("THERM-001"), codes(critical));
        assertEquals(List.of("THERM-002"), codes(attention));
        assertEquals(Verdict.APPROVED_WITH_COMMENTS, attention.getVerdict());
        assertTrue(codes(normal).isEmpty());
    }

    @Test
    void shouldRequireLoadAndReflectedTemperatureForThermography() {
        EvaluationResult result = engine.evaluate(TestType.THERMOGRAPHY,
                fields(FieldNames.LOAD_CURRENT, 120.0).build(), List.of());

        assertEquals(List.of("THERM-003", "THERM-004"), codes(result));
        assertTrue(result.getNonConformities().get(0).getDescription().contains("percent of rated load"));
    }

    @Test
    void shouldRejectExpiredCalibrationForAnyTestType() {
        NormalizedExtraction extraction = fields(
                FieldNames.CALIBRATION_EXPIRY_DATE, "2024-01-09",
                FieldNames.MEASUREMENT_DATE, "2024-01-10",
                FieldNames.GROUND_RESISTANCE, 1.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        assertEquals(List.of(RulesEngine.CALIBRATION_EXPIRED), codes(result));
        assertEquals(Verdict.REJECTED, result.getVerdict());
    }

    @Test
    void shouldRejectExpiredCalibrationWrittenAsSpaceSeparatedDateTime() {
        // Given
        NormalizedExtraction extraction = fields(
                FieldNames.CALIBRATION_EXPIRY_DATE, "2024-01-10 00:00:00Z",
                FieldNames.MEASUREMENT_DATE, "2024-03-15",
                FieldNames.GROUND_RESISTANCE, 1.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        // When
        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        // Then
        assertEquals(List.of(RulesEngine.CALIBRATION_EXPIRED), codes(result));
        assertEquals(Verdict.REJECTED, result.getVerdict());
    }

    @Test
    void shouldCompareOffsetDateTimesOnTheirUtcDay() {
        // Given: 23:30 at UTC-05:00 is already the next day in UTC
        NormalizedExtraction extraction = fields(
                FieldNames.CALIBRATION_EXPIRY_DATE, "2024-01-10T23:30:00-0500",
                FieldNames.MEASUREMENT_DATE, "2024-01-11 08:00:00+00:00",
                FieldNames.GROUND_RESISTANCE, 1.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        // When
        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        // Then
        assertEquals(List.of(RulesEngine.CALIBRATION_EXPIRING_TODAY), codes(result));
    }

    @Test
    void shouldCommentOnCalibrationExpiringOnMeasurementDay() {
        NormalizedExtraction extraction = fields(
                FieldNames.CALIBRATION_EXPIRY_DATE, "2024-01-10",
                FieldNames.MEASUREMENT_DATE, "2024-01-10T15:30:00Z",
                FieldNames.GROUND_RESISTANCE, 1.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of());

        assertEquals(List.of(RulesEngine.CALIBRATION_EXPIRING_TODAY), codes(result));
        assertEquals(Verdict.APPROVED_WITH_COMMENTS, result.getVerdict());
    }

    @Test
    void shouldAppendInconsistenciesWithTheirSeverity() {
        NormalizedExtraction extraction = fields(
                FieldNames.GROUND_RESISTANCE, 1.0,
                FieldNames.PHOTO_WATERMARK_PRESENT, true,
                FieldNames.TECHNICIAN_SIGNATURE_PRESENT, true).build();
        Inconsistency tag = Inconsistency.builder()
                .code("TAG-001").severity(Severity.CRITICAL).field(FieldNames.EQUIPMENT_TAG)
                .expected("EQ-01").found("EQ-02").message("Equipment TAG differs between sources")
                .build();
        Inconsistency display = Inconsistency.builder()
                .code("VALUE-001").severity(Severity.MINOR).field(FieldNames.DISPLAY_VALUE)
                .expected("4.0").found("4.5").message("Display value differs")
                .build();

        EvaluationResult result = engine.evaluate(TestType.GROUNDING, extraction, List.of(tag, display));

        assertEquals(List.of("TAG-001", "VALUE-001"), codes(result));
        assertEquals(Severity.CRITICAL, result.getNonConformities().get(0).getSeverity());
        assertEquals(Severity.MINOR, result.getNonConformities().get(1).getSeverity());
        assertEquals("expected EQ-01, found EQ-02", result.getNonConformities().get(0).getEvidence());
        assertEquals(Verdict.REJECTED, result.getVerdict());
    }

    @Test
    void shouldDeriveVerdictFromSeverities() {
        for (TestType testType : TestType.values()) {
            EvaluationResult result = engine.evaluate(testType, NormalizedExtraction.empty(), List.of());
            boolean critical = result.getNonConformities().stream().anyMatch(nc -> nc.getSeverity() == Severity.CRITICAL);
            assertEquals(critical ? Verdict.REJECTED
                    : result.getNonConformities().isEmpty() ? Verdict.APPROVED : Verdict.APPROVED_WITH_COMMENTS,
                    result.getVerdict(), testType.name());
        }
    }
}
