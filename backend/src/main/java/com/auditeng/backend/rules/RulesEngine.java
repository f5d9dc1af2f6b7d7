package com.auditeng.backend.rules;

import com.auditeng.backend.model.Inconsistency;
import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.auditeng.backend.model.FieldNames.CALIBRATION_EXPIRY_DATE;
import static com.auditeng.backend.model.FieldNames.MEASUREMENT_DATE;

/**
 * Turns an extraction and its inconsistencies into non-conformities, a verdict and a score.
 * Universal calibration checks run first, then the rules of the test type, then every
 * inconsistency is appended with its own severity.
 */
@Component
public class RulesEngine {

    public static final String CALIBRATION_EXPIRED = "CAL-001";
    public static final String CALIBRATION_EXPIRING_TODAY = "CAL-002";

    private final Map<TestType, TestTypeRules> rulesByType = new EnumMap<>(TestType.class);

    public RulesEngine(List<TestTypeRules> rules) {
        for (TestTypeRules rule : rules) {
            rulesByType.put(rule.testType(), rule);
        }
    }

    public EvaluationResult evaluate(TestType testType, NormalizedExtraction extraction,
            List<Inconsistency> inconsistencies) {
        List<NonConformity> nonConformities = new ArrayList<>(universal(extraction));

        TestTypeRules rules = rulesByType.get(testType);
        if (rules != null) {
            nonConformities.addAll(rules.evaluate(extraction));
        }
        if (inconsistencies != null) {
            inconsistencies.stream().map(NonConformity::fromInconsistency).forEach(nonConformities::add);
        }

        Verdict verdict = Verdict.from(nonConformities);
        return EvaluationResult.builder()
                .nonConformities(nonConformities)
                .verdict(verdict)
                .score(ComplianceScore.score(verdict, nonConformities, extraction.averageConfidence()))
                .build();
    }

    private List<NonConformity> universal(NormalizedExtraction extraction) {
        List<NonConformity> found = new ArrayList<>();
        Optional<LocalDate> expiry = extraction.date(CALIBRATION_EXPIRY_DATE);
        Optional<LocalDate> measured = extraction.date(MEASUREMENT_DATE);
        if (expiry.isEmpty() || measured.isEmpty()) {
            return found;
        }
        if (CalibrationDates.isExpired(expiry.get(), measured.get())) {
            found.add(NonConformity.builder()
                    .code(CALIBRATION_EXPIRED)
                    .severity(Severity.CRITICAL)
                    .description("Instrument calibration expired on " + expiry.get()
                            + ", before the measurement on " + measured.get())
                    .evidence(CALIBRATION_EXPIRY_DATE + " = " + expiry.get())
                    .correctiveAction("Recalibrate the instrument and repeat the measurement")
                    .build());
        } else if (CalibrationDates.isExpiringToday(expiry.get(), measured.get())) {
            found.add(NonConformity.builder()
                    .code(CALIBRATION_EXPIRING_TODAY)
                    .severity(Severity.MINOR)
                    .description("Instrument calibration expires on the measurement day " + measured.get())
                    .evidence(CALIBRATION_EXPIRY_DATE + " = " + expiry.get())
                    .correctiveAction("Send the instrument for recalibration before its next use")
                    .build());
        }
        return found;
    }
}
