package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Reads nameplate identification and instrument display values from a visible-light photo.
 */
@Component
public class VisiblePhotoExtractor implements DocumentExtractor {

    @Override
    public String name() {
        return "visible-photo";
    }

    @Override
    public ImageType imageType() {
        return ImageType.VISIBLE;
    }

    @Override
    public String buildSystemPrompt(ExtractionRequest request) {
        return ExtractionPrompts.withContext(ExtractionPrompts.VISIBLE_PHOTO_SYSTEM_PROMPT, request.getContextAddition());
    }

    @Override
    public String buildUserPrompt(ExtractionRequest request) {
        return ExtractionPrompts.visiblePhotoUserPrompt(request);
    }

    @Override
    public DocumentExtraction parseResponse(String content) {
        JsonNode root = FieldNormalizer.readJson(content);
        JsonNode equipment = root.path("equipment");
        JsonNode instrument = root.path("instrument");
        List<DisplayReading> displays = displayReadings(root.get("displayReadings"));

        NormalizedExtraction.Builder fields = NormalizedExtraction.builder()
                .field(EQUIPMENT_TAG, FieldNormalizer.text(equipment.get("tag"), "tag not visible"))
                .field(EQUIPMENT_SERIAL, FieldNormalizer.text(equipment.get("serial"), "serial not visible"))
                .field(INSTRUMENT_SERIAL, FieldNormalizer.text(instrument.get("serialNumber"), "instrument not photographed"))
                .field(INSTRUMENT_MODEL, FieldNormalizer.text(instrument.get("model"), "instrument not photographed"))
                .field(PHOTO_WATERMARK_PRESENT, FieldNormalizer.flag(root.get("watermark"), "watermark not assessed"));
        if (displays.isEmpty()) {
            fields.field(DISPLAY_VALUE, ExtractedField.notFound("no display reading"));
        } else {
            DisplayReading first = displays.get(0);
            fields.field(DISPLAY_VALUE, first.getValue());
            if (first.getUnit() != null) {
                fields.field(DISPLAY_UNIT, ExtractedField.of(first.getUnit(), first.getValue().getConfidence(),
                        first.getValue().getSource()));
            }
        }
        NormalizedExtraction normalized = fields.build();

        return DocumentExtraction.builder()
                .imageType(ImageType.VISIBLE)
                .fields(normalized)
                .displayReadings(displays)
                .overallConfidence(FieldNormalizer.overallConfidence(root, normalized))
                .warnings(FieldNormalizer.warnings(root))
                .build();
    }

    private static List<DisplayReading> displayReadings(JsonNode array) {
        List<DisplayReading> readings = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return readings;
        }
        for (JsonNode item : array) {
            ExtractedField<Double> value = FieldNormalizer.number(item.get("value"), "display value");
            if (!value.isPresent()) {
                continue;
            }
            readings.add(DisplayReading.builder()
                    .value(value)
                    .unit(item.hasNonNull("unit") ? item.get("unit").asText() : null)
                    .mode(item.hasNonNull("mode") ? item.get("mode").asText() : null)
                    .build());
        }
        return readings;
    }
}
