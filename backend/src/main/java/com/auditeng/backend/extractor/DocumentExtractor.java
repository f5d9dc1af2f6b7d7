package com.auditeng.backend.extractor;

import com.auditeng.backend.extraction.ExtractionSpec;
import com.auditeng.backend.model.ImageType;

import java.util.List;

/**
 * Extraction of one kind of report image.
 */
public interface DocumentExtractor extends ExtractionSpec<ExtractionRequest, DocumentExtraction> {

    ImageType imageType();

    @Override
    default List<String> images(ExtractionRequest request) {
        return List.of(ImageInputs.prepare(request.getImage()));
    }
}
