package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ExtractedField;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Equipment tag and serial chosen across all images of a batch, with the image each came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentIdentification {

    @Builder.Default
    private ExtractedField<?> tag = ExtractedField.notFound("no image reported a tag");

    @Builder.Default
    private ExtractedField<?> serial = ExtractedField.notFound("no image reported a serial");

    private String tagSource;
    private String serialSource;
}
