package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized result of extracting one image.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentExtraction {

    private ImageType imageType;

    @Builder.Default
    private NormalizedExtraction fields = NormalizedExtraction.empty();

    @Builder.Default
    private List<SpotReading> spotReadings = new ArrayList<>();

    @Builder.Default
    private List<DisplayReading> displayReadings = new ArrayList<>();

    private double overallConfidence;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
