package com.auditeng.backend.rules;

import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Grounding resistance report rules.
 */
@Component
public class GroundingRules implements TestTypeRules {

    static final double MAX_GROUND_RESISTANCE_OHMS = 5.0;

    @Override
    public TestType testType() {
        return TestType.GROUNDING;
    }

    @Override
    public List<NonConformity> evaluate(NormalizedExtraction extraction) {
        List<NonConformity> found = new ArrayList<>();

        Optional<Double> resistance = extraction.number(GROUND_RESISTANCE);
        if (resistance.isPresent() && resistance.get() > MAX_GROUND_RESISTANCE_OHMS) {
            found.add(NonConformity.builder()
                    .code("GND-001")
                    .severity(Severity.CRITICAL)
                    .description("Ground resistance " + resistance.get() + " ohm exceeds the "
                            + MAX_GROUND_RESISTANCE_OHMS + " ohm limit")
                    .evidence(GROUND_RESISTANCE + " = " + resistance.get())
                    .correctiveAction("Improve the grounding system (additional rods, soil treatment) and repeat the measurement")
                    .build());
        }
        if (!extraction.flag(PHOTO_WATERMARK_PRESENT).orElse(false)) {
            found.add(NonConformity.builder()
                    .code("GND-002")
                    .severity(Severity.MAJOR)
                    .description("Measurement photos have no date/time watermark")
                    .correctiveAction("Resubmit photos with the camera watermark enabled")
                    .build());
        }
        if (!extraction.flag(TECHNICIAN_SIGNATURE_PRESENT).orElse(false)) {
            found.add(NonConformity.builder()
                    .code("GND-003")
                    .severity(Severity.MAJOR)
                    .description("Report is not signed by the responsible technician")
                    .correctiveAction("Have the responsible technician sign the report")
                    .build());
        }
        return found;
    }
}
