package com.auditeng.backend.extractor;

import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.PhaseCombination;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Reads header, data table and test measurements from a page of the test report itself.
 */
@Component
public class ReportPageExtractor implements DocumentExtractor {

    @Override
    public String name() {
        return "report-page";
    }

    @Override
    public ImageType imageType() {
        return ImageType.REPORT_PAGE;
    }

    @Override
    public String buildSystemPrompt(ExtractionRequest request) {
        return ExtractionPrompts.withContext(ExtractionPrompts.REPORT_PAGE_SYSTEM_PROMPT, request.getContextAddition());
    }

    @Override
    public String buildUserPrompt(ExtractionRequest request) {
        return ExtractionPrompts.reportPageUserPrompt(request);
    }

    @Override
    public DocumentExtraction parseResponse(String content) {
        JsonNode root = FieldNormalizer.readJson(content);
        JsonNode header = root.path("header");
        JsonNode table = root.path("dataTable");
        JsonNode measurements = root.path("measurements");
        JsonNode insulation = measurements.path("insulationResistance");

        NormalizedExtraction.Builder fields = NormalizedExtraction.builder()
                .field(EQUIPMENT_TAG, FieldNormalizer.text(header.get("equipmentTag"), "tag not in header"))
                .field(INSTRUMENT_SERIAL, FieldNormalizer.text(header.get("instrumentSerial"), "instrument serial not in header"))
                .field(MEASUREMENT_DATE, FieldNormalizer.date(header.get("measurementDate"), "measurement date not in header"))
                .field(TECHNICIAN_NAME, FieldNormalizer.text(header.get("technicianName"), "technician not named"))
                .field(TECHNICIAN_SIGNATURE_PRESENT, FieldNormalizer.flag(root.get("technicianSignaturePresent"), "signature not assessed"))
                .field(PHOTO_WATERMARK_PRESENT, FieldNormalizer.flag(root.get("photoWatermarkPresent"), "watermark not assessed"))
                .field(TABLE_EQUIPMENT_TAG, FieldNormalizer.text(table.get("equipmentTag"), "no data table tag"))
                .field(TABLE_VALUE, FieldNormalizer.number(table.get("reading"), "no data table reading"))
                .field(GROUND_RESISTANCE, FieldNormalizer.number(measurements.get("groundResistance"), "ground resistance not reported"))
                .field(ABSORPTION_INDEX, FieldNormalizer.number(measurements.get("absorptionIndex"), "absorption index not reported"))
                .field(POLARIZATION_INDEX, FieldNormalizer.number(measurements.get("polarizationIndex"), "polarization index not reported"))
                .field(TEST_VOLTAGE, FieldNormalizer.number(measurements.get("testVoltage"), "test voltage not reported"))
                .field(PHASE_DELTA_T, FieldNormalizer.number(measurements.get("phaseDeltaT"), "delta T not reported"))
                .field(LOAD_CURRENT, FieldNormalizer.number(measurements.get("loadCurrent"), "load current not reported"))
                .field(LOAD_PERCENT, FieldNormalizer.number(measurements.get("loadPercent"), "load percent not reported"))
                .field(AMBIENT_TEMPERATURE, FieldNormalizer.number(measurements.get("ambientTemperature"), "ambient temperature not reported"))
                .field(REFLECTED_TEMPERATURE, FieldNormalizer.number(measurements.get("reflectedTemperature"), "reflected temperature not reported"));
        for (PhaseCombination combination : PhaseCombination.values()) {
            fields.field(combination.fieldName(),
                    FieldNormalizer.number(insulation.get(combination.label()), combination.label() + " not reported"));
        }
        NormalizedExtraction normalized = fields.build();

        return DocumentExtraction.builder()
                .imageType(ImageType.REPORT_PAGE)
                .fields(normalized)
                .overallConfidence(FieldNormalizer.overallConfidence(root, normalized))
                .warnings(FieldNormalizer.warnings(root))
                .build();
    }
}
