package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Reads equipment identification, camera parameters and temperatures from a thermal image.
 */
@Component
public class ThermalImageExtractor implements DocumentExtractor {

    @Override
    public String name() {
        return "thermal-image";
    }

    @Override
    public ImageType imageType() {
        return ImageType.THERMAL;
    }

    @Override
    public String buildSystemPrompt(ExtractionRequest request) {
        return ExtractionPrompts.withContext(ExtractionPrompts.THERMAL_IMAGE_SYSTEM_PROMPT, request.getContextAddition());
    }

    @Override
    public String buildUserPrompt(ExtractionRequest request) {
        return ExtractionPrompts.thermalImageUserPrompt(request);
    }

    @Override
    public DocumentExtraction parseResponse(String content) {
        JsonNode root = FieldNormalizer.readJson(content);
        JsonNode equipment = root.path("equipment");
        JsonNode camera = root.path("cameraParameters");
        JsonNode readings = root.path("readings");
        JsonNode instrument = root.path("instrument");

        NormalizedExtraction fields = NormalizedExtraction.builder()
                .field(EQUIPMENT_TAG, FieldNormalizer.text(equipment.get("tag"), "tag not visible"))
                .field(EQUIPMENT_SERIAL, FieldNormalizer.text(equipment.get("serial"), "serial not visible"))
                .field(EQUIPMENT_TYPE, FieldNormalizer.text(equipment.get("description"), "description not visible"))
                .field(EQUIPMENT_LOCATION, FieldNormalizer.text(equipment.get("location"), "location not visible"))
                .field(AMBIENT_TEMPERATURE, FieldNormalizer.number(camera.get("ambientTemperature"), "ambient temperature not in overlay"))
                .field(REFLECTED_TEMPERATURE, FieldNormalizer.number(camera.get("reflectedTemperature"), "reflected temperature not in overlay"))
                .field(EMISSIVITY, FieldNormalizer.number(camera.get("emissivity"), "emissivity not in overlay"))
                .field(MAX_TEMPERATURE, FieldNormalizer.number(readings.get("maxTemperature"), "max temperature not visible"))
                .field(MIN_TEMPERATURE, FieldNormalizer.number(readings.get("minTemperature"), "min temperature not visible"))
                .field(DELTA_T, FieldNormalizer.number(readings.get("deltaT"), "delta T not shown"))
                .field(INSTRUMENT_SERIAL, FieldNormalizer.text(instrument.get("serialNumber"), "camera serial not visible"))
                .field(INSTRUMENT_MODEL, FieldNormalizer.text(instrument.get("model"), "camera model not visible"))
                .build();

        return DocumentExtraction.builder()
                .imageType(ImageType.THERMAL)
                .fields(fields)
                .spotReadings(FieldNormalizer.spotReadings(root.get("spotReadings")))
                .overallConfidence(FieldNormalizer.overallConfidence(root, fields))
                .warnings(FieldNormalizer.warnings(root))
                .build();
    }
}
