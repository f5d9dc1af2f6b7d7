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
 * Infrared thermography report rules.
 */
@Component
public class ThermographyRules implements TestTypeRules {

    static final double CRITICAL_DELTA_T = 15.0;
    static final double ATTENTION_DELTA_T = 3.0;

    @Override
    public TestType testType() {
        return TestType.THERMOGRAPHY;
    }

    @Override
    public List<NonConformity> evaluate(NormalizedExtraction extraction) {
        List<NonConformity> found = new ArrayList<>();

        Optional<Double> deltaT = extraction.number(PHASE_DELTA_T).or(() -> extraction.number(DELTA_T));
        if (deltaT.isPresent() && deltaT.get() > CRITICAL_DELTA_T) {
            found.add(NonConformity.builder()
                    .code("THERM-001")
                    .severity(Severity.CRITICAL)
                    .description("Phase-to-phase delta T of " + deltaT.get() + " C exceeds " + CRITICAL_DELTA_T + " C")
                    .evidence("delta T = " + deltaT.get())
                    .correctiveAction("Repair the hot spot immediately and repeat the inspection under load")
                    .build());
        } else if (deltaT.isPresent() && deltaT.get() > ATTENTION_DELTA_T) {
            found.add(NonConformity.builder()
                    .code("THERM-002")
                    .severity(Severity.MINOR)
                    .description("Phase-to-phase delta T of " + deltaT.get() + " C needs monitoring")
                    .evidence("delta T = " + deltaT.get())
                    .correctiveAction("Schedule corrective maintenance and monitor the connection")
                    .build());
        }

        List<String> missingLoad = new ArrayList<>();
        if (!extraction.has(LOAD_CURRENT)) {
            missingLoad.add("load current");
        }
        if (!extraction.has(LOAD_PERCENT)) {
            missingLoad.add("percent of rated load");
        }
        if (!missingLoad.isEmpty()) {
            found.add(NonConformity.builder()
                    .code("THERM-003")
                    .severity(Severity.MAJOR)
                    .description("Missing mandatory load reading: " + String.join(" and ", missingLoad))
                    .correctiveAction("Record the load current and percent of rated load at inspection time")
                    .build());
        }

        if (!extraction.has(REFLECTED_TEMPERATURE)) {
            found.add(NonConformity.builder()
                    .code("THERM-004")
                    .severity(Severity.MINOR)
                    .description("Reflected temperature is not documented")
                    .correctiveAction("Document the reflected apparent temperature used by the camera")
                    .build());
        }
        return found;
    }
}
