package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Reads certificate number, calibration dates and instrument serial from a calibration certificate.
 */
@Component
public class CertificateExtractor implements DocumentExtractor {

    @Override
    public String name() {
        return "calibration-certificate";
    }

    @Override
    public ImageType imageType() {
        return ImageType.CERTIFICATE;
    }

    @Override
    public String buildSystemPrompt(ExtractionRequest request) {
        return ExtractionPrompts.withContext(ExtractionPrompts.CERTIFICATE_SYSTEM_PROMPT, request.getContextAddition());
    }

    @Override
    public String buildUserPrompt(ExtractionRequest request) {
        return ExtractionPrompts.certificateUserPrompt(request);
    }

    @Override
    public DocumentExtraction parseResponse(String content) {
        JsonNode root = FieldNormalizer.readJson(content);
        JsonNode instrument = root.path("instrument");
        JsonNode laboratory = root.path("laboratory");

        NormalizedExtraction fields = NormalizedExtraction.builder()
                .field(CERTIFICATE_NUMBER, FieldNormalizer.text(root.get("certificateNumber"), "certificate number not found"))
                .field(CALIBRATION_DATE, FieldNormalizer.date(root.get("calibrationDate"), "calibration date not found"))
                .field(CALIBRATION_EXPIRY_DATE, FieldNormalizer.date(root.get("expiryDate"), "expiry date not found"))
                .field(INSTRUMENT_SERIAL, FieldNormalizer.text(instrument.get("serialNumber"), "instrument serial not found"))
                .field(INSTRUMENT_MODEL, FieldNormalizer.text(instrument.get("model"), "instrument model not found"))
                .field(CALIBRATION_LAB, FieldNormalizer.text(laboratory.get("name"), "laboratory not found"))
                .build();

        return DocumentExtraction.builder()
                .imageType(ImageType.CERTIFICATE)
                .fields(fields)
                .overallConfidence(FieldNormalizer.overallConfidence(root, fields))
                .warnings(FieldNormalizer.warnings(root))
                .build();
    }
}
