package com.auditeng.backend.extractor;

import com.auditeng.backend.extraction.ExtractionResult;
import com.auditeng.backend.extraction.ResilientExtractionClient;
import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.FieldNames;
import com.auditeng.backend.model.ImageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Extracts every image of a report in input order and merges equipment identification across them.
 * A failed image is recorded and skipped; it never aborts the batch.
 */
public class BatchExtractor {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractor.class);

    private final ResilientExtractionClient client;
    private final Map<ImageType, DocumentExtractor> extractors = new EnumMap<>(ImageType.class);

    public BatchExtractor(ResilientExtractionClient client, List<DocumentExtractor> extractors) {
        this.client = client;
        for (DocumentExtractor extractor : extractors) {
            this.extractors.put(extractor.imageType(), extractor);
        }
    }

    public BatchExtractionResult extract(String reportId, List<ExtractionRequest> requests) {
        return extract(reportId, requests, () -> false);
    }

    /**
     * @param cancelled checked before each image; once true the remaining images are skipped
     */
    public BatchExtractionResult extract(String reportId, List<ExtractionRequest> requests, BooleanSupplier cancelled) {
        long start = System.currentTimeMillis();
        List<ImageExtraction> images = new ArrayList<>();
        Map<ImageType, Integer> perTypeCounter = new EnumMap<>(ImageType.class);
        Set<String> modelsUsed = new LinkedHashSet<>();
        long totalTokens = 0;
        double totalCost = 0.0;
        int successful = 0;
        boolean stoppedEarly = false;

        for (int i = 0; i < requests.size(); i++) {
            if (cancelled.getAsBoolean()) {
                log.info("[EXTRACTION] Batch {} cancelled after {}/{} images", reportId, i, requests.size());
                stoppedEarly = true;
                break;
            }
            ExtractionRequest request = requests.get(i);
            ImageType type = request.getImageType();
            int ordinal = perTypeCounter.merge(type, 1, Integer::sum);
            String sourceName = sourcePrefix(type) + ordinal;

            ImageExtraction.ImageExtractionBuilder outcome = ImageExtraction.builder()
                    .index(i)
                    .imageType(type)
                    .sourceName(sourceName);

            DocumentExtractor extractor = extractors.get(type);
            if (extractor == null) {
                images.add(outcome.error("No extractor for image type " + type).build());
                continue;
            }
            if (!ImageInputs.isValid(request.getImage())) {
                log.warn("[EXTRACTION] Batch {} image {} ({}) skipped: invalid image input", reportId, i, sourceName);
                images.add(outcome.error("Invalid image input").build());
                continue;
            }

            ExtractionResult<DocumentExtraction> result = client.extract(extractor, request);
            if (result.getMetrics() != null) {
                totalTokens += result.getMetrics().getTotalTokens();
                totalCost += result.getMetrics().getEstimatedCost();
                if (result.isSuccess() && result.getMetrics().getModelUsed() != null) {
                    modelsUsed.add(result.getMetrics().getModelUsed());
                }
            }
            if (result.isSuccess()) {
                successful++;
                images.add(outcome.extraction(result.getData()).build());
            } else {
                log.warn("[EXTRACTION] Batch {} image {} ({}) failed: {}", reportId, i, sourceName, result.getError());
                images.add(outcome.error(result.getError()).build());
            }
        }

        BatchExtractionResult batch = BatchExtractionResult.builder()
                .reportId(reportId)
                .images(images)
                .mergedEquipment(mergeEquipment(images))
                .totalImages(requests.size())
                .successfulImages(successful)
                .totalTokens(totalTokens)
                .totalCost(totalCost)
                .processingTimeMs(System.currentTimeMillis() - start)
                .modelsUsed(new ArrayList<>(modelsUsed))
                .cancelled(stoppedEarly)
                .build();
        log.info("[EXTRACTION] Batch {} done: {}/{} images, tokens={}, cost=${}", reportId, successful,
                requests.size(), totalTokens, String.format(Locale.ROOT, "%.4f", totalCost));
        return batch;
    }

    private static String sourcePrefix(ImageType type) {
        switch (type) {
            case THERMAL:
                return "thermal_image_";
            case VISIBLE:
                return "visible_photo_";
            case CERTIFICATE:
                return "certificate_";
            default:
                return "report_page_";
        }
    }

    /**
     * Picks tag and serial independently: the highest confidence wins, ties go to the earlier image.
     */
    static EquipmentIdentification mergeEquipment(List<ImageExtraction> images) {
        EquipmentIdentification merged = new EquipmentIdentification();
        for (ImageExtraction image : images) {
            if (!image.isSuccess()) {
                continue;
            }
            ExtractedField<?> tag = image.getExtraction().getFields().get(FieldNames.EQUIPMENT_TAG);
            if (tag.isPresent() && (merged.getTagSource() == null || tag.getConfidence() > merged.getTag().getConfidence())) {
                merged.setTag(tag);
                merged.setTagSource(image.getSourceName());
            }
            ExtractedField<?> serial = image.getExtraction().getFields().get(FieldNames.EQUIPMENT_SERIAL);
            if (serial.isPresent() && (merged.getSerialSource() == null
                    || serial.getConfidence() > merged.getSerial().getConfidence())) {
                merged.setSerial(serial);
                merged.setSerialSource(image.getSourceName());
            }
        }
        return merged;
    }
}
