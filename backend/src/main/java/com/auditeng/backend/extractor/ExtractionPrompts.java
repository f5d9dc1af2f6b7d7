package com.auditeng.backend.extractor;

import com.auditeng.backend.model.TestType;

/**
 * Prompt templates for document extraction.
 */
public final class ExtractionPrompts {

    private static final String FIELD = "{\"value\": %s, \"confidence\": 0.0-1.0, \"source\": \"where it was found\"}";
    private static final String TEXT_FIELD = String.format(FIELD, "\"string or null\"");
    private static final String NUMBER_FIELD = String.format(FIELD, "number or null");
    private static final String BOOLEAN_FIELD = String.format(FIELD, "true, false or null");
    private static final String DATE_FIELD = String.format(FIELD, "\"YYYY-MM-DD or null\"");

    private static final String OUTPUT_RULES = "\n\n## OUTPUT REQUIREMENTS\n"
            + "- Return ONLY valid JSON matching the requested structure\n"
            + "- Use null for anything that is not visible; never invent values\n"
            + "- Confidence: 0.95+ clearly visible, 0.80-0.95 partially visible, below 0.80 inferred\n"
            + "- Numbers must be JSON numbers, without units\n";

    public static final String THERMAL_IMAGE_SYSTEM_PROMPT = "You are a Level III certified thermographer analyzing "
            + "infrared images of electrical equipment (switchgear, transformers, PDUs, breakers) for compliance audits.\n\n"
            + "## YOUR TASK\n"
            + "Extract from the thermal image:\n"
            + "1. Equipment identification: TAG on labels or nameplates, serial number, description, location\n"
            + "2. Camera parameters from the overlay: ambient temperature (Tatm, Ta), reflected temperature (Trefl, Tr), "
            + "emissivity (E), distance, humidity\n"
            + "3. Temperature readings: maximum, minimum, delta T, spot readings (Sp1, Sp2...)\n"
            + "4. Instrument: camera serial number and model\n\n"
            + "## RULES\n"
            + "- Convert Fahrenheit to Celsius\n"
            + "- Emissivity is usually between 0.80 and 0.98 for electrical components\n"
            + "- Reflected temperature is usually within 1-2 C of ambient"
            + OUTPUT_RULES;

    public static final String VISIBLE_PHOTO_SYSTEM_PROMPT = "You are a data extraction specialist analyzing photos "
            + "of electrical equipment and test instruments for audit purposes.\n\n"
            + "## YOUR TASK\n"
            + "Extract from the photo:\n"
            + "1. Equipment identification: TAG on nameplates (e.g. PDU-A-01, SWBD-103), serial number, manufacturer, model\n"
            + "2. Instrument display readings: numeric value, unit (C, ohm, Mohm, A, V...), mode\n"
            + "3. Test instrument serial number and model if the instrument itself is photographed\n"
            + "4. Whether the photo carries a date/time watermark\n\n"
            + "## RULES\n"
            + "- If text is blurry give what is visible with confidence below 0.80; do not guess obscured characters\n"
            + "- Preserve the exact formatting of TAGs and serial numbers"
            + OUTPUT_RULES;

    public static final String CERTIFICATE_SYSTEM_PROMPT = "You are a metrology specialist analyzing calibration "
            + "certificates of test instruments under ISO 17025.\n\n"
            + "## YOUR TASK\n"
            + "Extract: certificate number, calibration date, expiry (due) date, instrument serial number, model and "
            + "manufacturer, laboratory name and accreditation.\n\n"
            + "## RULES\n"
            + "- The instrument serial number is the highest priority: it is cross-checked against the report\n"
            + "- Convert every date to ISO format (YYYY-MM-DD); report ambiguous formats in warnings\n"
            + "- Preserve leading zeros in serial numbers"
            + OUTPUT_RULES;

    public static final String REPORT_PAGE_SYSTEM_PROMPT = "You are an electrical commissioning auditor reading a "
            + "page of a field test report (grounding, insulation resistance or thermography).\n\n"
            + "## YOUR TASK\n"
            + "Extract the report header (equipment TAG, test instrument serial, measurement date, technician), "
            + "whether the technician signature and photo watermarks are present, the data table (TAG and main "
            + "reading) and the measurements the test requires.\n\n"
            + "## RULES\n"
            + "- Insulation resistance values in megohms; ground resistance in ohms; temperatures in Celsius\n"
            + "- Dates in ISO format (YYYY-MM-DD)"
            + OUTPUT_RULES;

    private ExtractionPrompts() {
    }

    public static String withContext(String systemPrompt, String contextAddition) {
        if (contextAddition == null || contextAddition.isBlank()) {
            return systemPrompt;
        }
        return systemPrompt + "\n\n" + contextAddition;
    }

    public static String thermalImageUserPrompt(ExtractionRequest request) {
        return "Analyze this thermal image and extract all visible data points.\n\n"
                + "Return a JSON object with this structure:\n"
                + "{\n"
                + "  \"equipment\": {\"tag\": " + TEXT_FIELD + ", \"serial\": " + TEXT_FIELD
                + ", \"description\": " + TEXT_FIELD + ", \"location\": " + TEXT_FIELD + "},\n"
                + "  \"cameraParameters\": {\"ambientTemperature\": " + NUMBER_FIELD
                + ", \"reflectedTemperature\": " + NUMBER_FIELD + ", \"emissivity\": " + NUMBER_FIELD
                + ", \"distance\": " + NUMBER_FIELD + ", \"humidity\": " + NUMBER_FIELD + "},\n"
                + "  \"readings\": {\"maxTemperature\": " + NUMBER_FIELD + ", \"minTemperature\": " + NUMBER_FIELD
                + ", \"deltaT\": " + NUMBER_FIELD + "},\n"
                + "  \"spotReadings\": [{\"label\": \"Sp1\", \"temperature\": " + NUMBER_FIELD + "}],\n"
                + "  \"instrument\": {\"serialNumber\": " + TEXT_FIELD + ", \"model\": " + TEXT_FIELD + "},\n"
                + "  \"overallConfidence\": 0.0-1.0,\n"
                + "  \"warnings\": [\"image quality or reading problems\"]\n"
                + "}"
                + context(request);
    }

    public static String visiblePhotoUserPrompt(ExtractionRequest request) {
        return "Analyze this photo and extract equipment identification and display readings.\n\n"
                + "Return a JSON object with this structure:\n"
                + "{\n"
                + "  \"equipment\": {\"tag\": " + TEXT_FIELD + ", \"serial\": " + TEXT_FIELD
                + ", \"manufacturer\": " + TEXT_FIELD + ", \"model\": " + TEXT_FIELD + "},\n"
                + "  \"displayReadings\": [{\"value\": " + NUMBER_FIELD + ", \"unit\": \"string\", \"mode\": \"string\"}],\n"
                + "  \"instrument\": {\"serialNumber\": " + TEXT_FIELD + ", \"model\": " + TEXT_FIELD + "},\n"
                + "  \"watermark\": " + BOOLEAN_FIELD + ",\n"
                + "  \"overallConfidence\": 0.0-1.0,\n"
                + "  \"warnings\": []\n"
                + "}"
                + context(request);
    }

    public static String certificateUserPrompt(ExtractionRequest request) {
        return "Analyze this calibration certificate.\n\n"
                + "Return a JSON object with this structure:\n"
                + "{\n"
                + "  \"certificateNumber\": " + TEXT_FIELD + ",\n"
                + "  \"calibrationDate\": " + DATE_FIELD + ",\n"
                + "  \"expiryDate\": " + DATE_FIELD + ",\n"
                + "  \"instrument\": {\"serialNumber\": " + TEXT_FIELD + ", \"model\": " + TEXT_FIELD
                + ", \"manufacturer\": " + TEXT_FIELD + "},\n"
                + "  \"laboratory\": {\"name\": " + TEXT_FIELD + ", \"accreditation\": " + TEXT_FIELD + "},\n"
                + "  \"overallConfidence\": 0.0-1.0,\n"
                + "  \"warnings\": []\n"
                + "}"
                + context(request);
    }

    public static String reportPageUserPrompt(ExtractionRequest request) {
        return "Analyze this test report page.\n\n"
                + "Return a JSON object with this structure:\n"
                + "{\n"
                + "  \"header\": {\"equipmentTag\": " + TEXT_FIELD + ", \"instrumentSerial\": " + TEXT_FIELD
                + ", \"measurementDate\": " + DATE_FIELD + ", \"technicianName\": " + TEXT_FIELD + "},\n"
                + "  \"technicianSignaturePresent\": " + BOOLEAN_FIELD + ",\n"
                + "  \"photoWatermarkPresent\": " + BOOLEAN_FIELD + ",\n"
                + "  \"dataTable\": {\"equipmentTag\": " + TEXT_FIELD + ", \"reading\": " + NUMBER_FIELD + "},\n"
                + "  \"measurements\": {\n"
                + "    \"groundResistance\": " + NUMBER_FIELD + ",\n"
                + "    \"insulationResistance\": {\"A-B\": " + NUMBER_FIELD + ", \"A-C\": ..., \"B-C\": ..., "
                + "\"A-G\": ..., \"B-G\": ..., \"C-G\": ...},\n"
                + "    \"absorptionIndex\": " + NUMBER_FIELD + ", \"polarizationIndex\": " + NUMBER_FIELD
                + ", \"testVoltage\": " + NUMBER_FIELD + ",\n"
                + "    \"phaseDeltaT\": " + NUMBER_FIELD + ", \"loadCurrent\": " + NUMBER_FIELD
                + ", \"loadPercent\": " + NUMBER_FIELD + ",\n"
                + "    \"ambientTemperature\": " + NUMBER_FIELD + ", \"reflectedTemperature\": " + NUMBER_FIELD + "\n"
                + "  },\n"
                + "  \"overallConfidence\": 0.0-1.0,\n"
                + "  \"warnings\": []\n"
                + "}"
                + context(request);
    }

    private static String context(ExtractionRequest request) {
        StringBuilder context = new StringBuilder();
        if (request.getTestType() != null) {
            context.append("\nTest type: ").append(describe(request.getTestType()));
        }
        if (request.getPageNumber() != null) {
            context.append("\nPage number: ").append(request.getPageNumber());
        }
        if (request.getReportSection() != null) {
            context.append("\nReport section: ").append(request.getReportSection());
        }
        if (request.getExpectedTag() != null) {
            context.append("\nExpected equipment TAG: ").append(request.getExpectedTag())
                    .append(" (verify whether it matches)");
        }
        if (request.getExpectedSerial() != null) {
            context.append("\nExpected serial number: ").append(request.getExpectedSerial())
                    .append(" (verify whether it matches)");
        }
        if (request.getExpectedInstrumentModel() != null) {
            context.append("\nExpected instrument model: ").append(request.getExpectedInstrumentModel());
        }
        String section = context.length() == 0 ? "" : "\n\n## CONTEXT" + context;
        if (request.getUserHints() != null && !request.getUserHints().isBlank()) {
            section += "\n\n" + request.getUserHints();
        }
        return section;
    }

    private static String describe(TestType testType) {
        switch (testType) {
            case GROUNDING:
                return "grounding resistance";
            case MEGGER:
                return "insulation resistance (megger)";
            case THERMOGRAPHY:
                return "infrared thermography";
            default:
                return testType.name();
        }
    }
}
