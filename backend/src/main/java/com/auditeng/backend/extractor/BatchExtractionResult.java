package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated result of extracting every image of one report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchExtractionResult {

    private String reportId;

    /** In input order. */
    @Builder.Default
    private List<ImageExtraction> images = new ArrayList<>();

    @Builder.Default
    private EquipmentIdentification mergedEquipment = new EquipmentIdentification();

    private int totalImages;
    private int successfulImages;
    private long totalTokens;
    private double totalCost;
    private long processingTimeMs;

    @Builder.Default
    private List<String> modelsUsed = new ArrayList<>();

    /** True when the run stopped early because it was cancelled. */
    private boolean cancelled;

    public List<DocumentExtraction> successful(ImageType type) {
        return images.stream()
                .filter(i -> i.isSuccess() && i.getImageType() == type)
                .map(ImageExtraction::getExtraction)
                .collect(Collectors.toList());
    }

    public List<ImageExtraction> errors() {
        return images.stream().filter(i -> !i.isSuccess()).collect(Collectors.toList());
    }
}
