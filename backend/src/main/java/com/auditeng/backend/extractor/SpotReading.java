package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ExtractedField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Labelled spot temperature from a thermal image (Sp1, Sp2...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpotReading {
    private String label;
    private ExtractedField<Double> temperature;
}
