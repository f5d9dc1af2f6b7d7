package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.TestType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of one single-image extraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {

    /** URL, data URL or raw base64 as submitted. */
    private String image;

    private ImageType imageType;
    private TestType testType;
    private Integer pageNumber;
    private String reportSection;

    // Hints for targeted cross-checking
    private String expectedTag;
    private String expectedSerial;
    private String expectedInstrumentModel;

    /** Retrieved knowledge appended to the system prompt. */
    private String contextAddition;

    /** Hints from past analyses appended to the user prompt. */
    private String userHints;
}
