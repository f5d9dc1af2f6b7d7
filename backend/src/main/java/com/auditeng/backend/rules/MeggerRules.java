package com.auditeng.backend.rules;

import com.auditeng.backend.model.NonConformity;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.PhaseCombination;
import com.auditeng.backend.model.Severity;
import com.auditeng.backend.model.TestType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

import static com.auditeng.backend.model.FieldNames.ABSORPTION_INDEX;

/**
 * Insulation resistance (megger) report rules.
 */
@Component
public class MeggerRules implements TestTypeRules {

    static final double MIN_INSULATION_MEGOHMS = 100.0;
    static final double MIN_ABSORPTION_INDEX = 1.4;

    @Override
    public TestType testType() {
        return TestType.MEGGER;
    }

    @Override
    public List<NonConformity> evaluate(NormalizedExtraction extraction) {
        List<NonConformity> found = new ArrayList<>();

        List<PhaseCombination> missing = new ArrayList<>();
        List<Double> readings = new ArrayList<>();
        for (PhaseCombination combination : PhaseCombination.values()) {
            Optional<Double> reading = extraction.number(combination.fieldName());
            if (reading.isPresent()) {
                readings.add(reading.get());
            } else {
                missing.add(combination);
            }
        }
        if (!missing.isEmpty()) {
            String labels = missing.stream().map(PhaseCombination::label).collect(Collectors.joining(", "));
            found.add(NonConformity.builder()
                    .code("MEG-001")
                    .severity(Severity.CRITICAL)
                    .description("Missing insulation resistance reading for phase combination(s): " + labels)
                    .evidence(readings.size() + " of " + PhaseCombination.values().length + " combinations reported")
                    .correctiveAction("Measure and report every phase-to-phase and phase-to-ground combination")
                    .build());
        }

        OptionalDouble minimum = readings.stream().mapToDouble(Double::doubleValue).min();
        if (minimum.isPresent() && minimum.getAsDouble() < MIN_INSULATION_MEGOHMS) {
            found.add(NonConformity.builder()
                    .code("MEG-002")
                    .severity(Severity.CRITICAL)
                    .description("Insulation resistance " + minimum.getAsDouble() + " Mohm is below the "
                            + MIN_INSULATION_MEGOHMS + " Mohm minimum")
                    .evidence("minimum reading = " + minimum.getAsDouble())
                    .correctiveAction("Investigate insulation degradation, dry or repair the equipment and retest")
                    .build());
        }

        Optional<Double> absorption = extraction.number(ABSORPTION_INDEX);
        if (absorption.isPresent() && absorption.get() < MIN_ABSORPTION_INDEX) {
            found.add(NonConformity.builder()
                    .code("MEG-003")
                    .severity(Severity.MAJOR)
                    .description("Absorption index " + absorption.get() + " is below " + MIN_ABSORPTION_INDEX)
                    .evidence(ABSORPTION_INDEX + " = " + absorption.get())
                    .correctiveAction("Check the insulation for moisture or contamination")
                    .build());
        }
        return found;
    }
}
