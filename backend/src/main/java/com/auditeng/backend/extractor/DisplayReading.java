package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ExtractedField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value shown on an instrument display in a visible photo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisplayReading {
    private ExtractedField<Double> value;
    private String unit;
    private String mode;
}
