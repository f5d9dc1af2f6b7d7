package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome for one image of a batch. Exactly one of {@code extraction} and {@code error} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageExtraction {
    private int index;
    private ImageType imageType;

    /** e.g. thermal_image_2, 1-based within its type. */
    private String sourceName;

    private DocumentExtraction extraction;
    private String error;

    public boolean isSuccess() {
        return extraction != null;
    }
}
