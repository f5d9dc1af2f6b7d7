package com.auditeng.backend.extractor;

import com.auditeng.backend.extraction.MalformedResponseException;
import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.NormalizedExtraction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns loosely structured model JSON into {@link ExtractedField}s.
 * <p>
 * Every reader accepts the {@code {value, confidence, source}} shape the prompts ask for.
 * A missing node, a null value or a value of the wrong kind becomes a not-found field;
 * confidence is clamped to [0, 1] and a non-numeric confidence reads as 0.
 */
public final class FieldNormalizer {

    /** Tolerates trailing commas, comments, single quotes and unquoted names. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(-?\\d+(?:[.,]\\d+)?)");

    private FieldNormalizer() {
    }

    /**
     * Parses a model reply, ignoring markdown code fences around it.
     *
     * @throws MalformedResponseException when the reply is not a JSON object
     */
    public static JsonNode readJson(String content) {
        if (content == null || content.isBlank()) {
            throw new MalformedResponseException("Empty model response", null);
        }
        String json = content.trim();
        if (json.startsWith("```")) {
            int firstNewline = json.indexOf('\n');
            int closingFence = json.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                json = json.substring(firstNewline + 1, closingFence).trim();
            }
        }
        try {
            JsonNode root = LENIENT_MAPPER.readTree(json);
            if (root == null || !root.isObject()) {
                throw new MalformedResponseException("Model response is not a JSON object", null);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Failed to parse model response: " + e.getOriginalMessage(), e);
        }
    }

    public static ExtractedField<String> text(JsonNode node, String reason) {
        JsonNode value = valueOf(node);
        if (value == null || !(value.isTextual() || value.isNumber())) {
            return ExtractedField.notFound(reason);
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return ExtractedField.notFound(reason);
        }
        return ExtractedField.of(text, confidence(node), source(node));
    }

    public static ExtractedField<Double> number(JsonNode node, String reason) {
        JsonNode value = valueOf(node);
        if (value == null) {
            return ExtractedField.notFound(reason);
        }
        Double number = null;
        if (value.isNumber()) {
            number = value.asDouble();
        } else if (value.isTextual()) {
            Matcher matcher = LEADING_NUMBER.matcher(value.asText());
            if (matcher.find()) {
                number = Double.parseDouble(matcher.group(1).replace(',', '.'));
            }
        }
        if (number == null || number.isNaN() || number.isInfinite()) {
            return ExtractedField.notFound(reason + " (malformed)");
        }
        return ExtractedField.of(number, confidence(node), source(node));
    }

    public static ExtractedField<Boolean> flag(JsonNode node, String reason) {
        JsonNode value = valueOf(node);
        if (value == null) {
            return ExtractedField.notFound(reason);
        }
        if (value.isBoolean()) {
            return ExtractedField.of(value.asBoolean(), confidence(node), source(node));
        }
        if (value.isTextual() && ("true".equalsIgnoreCase(value.asText()) || "false".equalsIgnoreCase(value.asText()))) {
            return ExtractedField.of(Boolean.parseBoolean(value.asText().toLowerCase()), confidence(node), source(node));
        }
        return ExtractedField.notFound(reason + " (malformed)");
    }

    /**
     * Reads an ISO date (YYYY-MM-DD, optionally followed by a time). Anything
     * {@link NormalizedExtraction#parseDate} cannot read is not found.
     */
    public static ExtractedField<String> date(JsonNode node, String reason) {
        ExtractedField<String> text = text(node, reason);
        if (!text.isPresent()) {
            return text;
        }
        return NormalizedExtraction.parseDate(text.getValue()).isPresent()
                ? text
                : ExtractedField.notFound(reason + " (malformed)");
    }

    public static double confidence(JsonNode node) {
        JsonNode confidence = node == null ? null : node.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            return 0.0;
        }
        return clamp(confidence.asDouble());
    }

    /**
     * Reads spot readings, keeping only entries with a label and a numeric temperature.
     */
    public static List<SpotReading> spotReadings(JsonNode array) {
        List<SpotReading> readings = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return readings;
        }
        for (JsonNode item : array) {
            String label = item.path("label").asText("").trim();
            JsonNode temperature = item.get("temperature");
            JsonNode value = valueOf(temperature);
            if (label.isEmpty() || value == null || !value.isNumber()) {
                continue;
            }
            String source = temperature.hasNonNull("source") ? temperature.get("source").asText() : "spot_reading";
            readings.add(SpotReading.builder()
                    .label(label)
                    .temperature(ExtractedField.of(value.asDouble(), confidence(temperature), source))
                    .build());
        }
        return readings;
    }

    public static List<String> warnings(JsonNode root) {
        List<String> warnings = new ArrayList<>();
        JsonNode array = root.get("warnings");
        if (array != null && array.isArray()) {
            array.forEach(w -> {
                if (w.isTextual() && !w.asText().isBlank()) {
                    warnings.add(w.asText());
                }
            });
        }
        return warnings;
    }

    /**
     * The reported overall confidence, or the mean field confidence when the model omitted it.
     */
    public static double overallConfidence(JsonNode root, NormalizedExtraction fields) {
        JsonNode overall = root.get("overallConfidence");
        if (overall != null && overall.isNumber()) {
            return clamp(overall.asDouble());
        }
        return fields.averageConfidence();
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static JsonNode valueOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get("value");
        return value == null || value.isNull() ? null : value;
    }

    private static String source(JsonNode node) {
        JsonNode source = node.get("source");
        return source != null && source.isTextual() && !source.asText().isBlank() ? source.asText() : ExtractedField.EXTRACTED;
    }
}
