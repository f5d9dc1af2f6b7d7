package com.auditeng.backend.validation;

import com.auditeng.backend.extractor.BatchExtractionResult;
import com.auditeng.backend.extractor.DocumentExtraction;
import com.auditeng.backend.model.ExtractedField;
import com.auditeng.backend.model.ImageType;
import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.TestType;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.auditeng.backend.model.FieldNames.*;

/**
 * Groups batch extraction output by evidence source.
 * <ul>
 *   <li>report pages: header fields go to REPORT, the data table tag and reading to DATA_TABLE</li>
 *   <li>visible photos: PHOTO</li>
 *   <li>thermal images: THERMAL_IMAGE, and the camera serial from the overlay to INSTRUMENT</li>
 *   <li>certificates: CERTIFICATE</li>
 * </ul>
 */
@Component
public class EvidenceConsolidator {

    public ConsolidatedEvidence consolidate(TestType testType, BatchExtractionResult batch) {
        ConsolidatedEvidence.Builder evidence = ConsolidatedEvidence.builder(testType);

        for (DocumentExtraction page : batch.successful(ImageType.REPORT_PAGE)) {
            NormalizedExtraction fields = page.getFields();
            NormalizedExtraction.Builder table = NormalizedExtraction.builder();
            copy(fields, TABLE_EQUIPMENT_TAG, table, EQUIPMENT_TAG);
            copy(fields, TABLE_VALUE, table, TABLE_VALUE);
            evidence.source(EvidenceSource.DATA_TABLE, table.build());

            NormalizedExtraction.Builder report = NormalizedExtraction.builder();
            fields.asMap().forEach((name, field) -> {
                if (!TABLE_EQUIPMENT_TAG.equals(name) && !TABLE_VALUE.equals(name)) {
                    report.field(name, field);
                }
            });
            evidence.source(EvidenceSource.REPORT, report.build());
        }

        mergeInto(evidence, EvidenceSource.PHOTO, batch.successful(ImageType.VISIBLE));
        mergeInto(evidence, EvidenceSource.CERTIFICATE, batch.successful(ImageType.CERTIFICATE));

        for (DocumentExtraction thermal : batch.successful(ImageType.THERMAL)) {
            NormalizedExtraction fields = thermal.getFields();
            NormalizedExtraction.Builder instrument = NormalizedExtraction.builder();
            copy(fields, INSTRUMENT_SERIAL, instrument, INSTRUMENT_SERIAL);
            copy(fields, INSTRUMENT_MODEL, instrument, INSTRUMENT_MODEL);
            evidence.source(EvidenceSource.INSTRUMENT, instrument.build());

            NormalizedExtraction.Builder image = NormalizedExtraction.builder();
            fields.asMap().forEach((name, field) -> {
                if (!INSTRUMENT_SERIAL.equals(name) && !INSTRUMENT_MODEL.equals(name)) {
                    image.field(name, field);
                }
            });
            evidence.source(EvidenceSource.THERMAL_IMAGE, image.build());
        }

        return evidence.build();
    }

    private static void mergeInto(ConsolidatedEvidence.Builder evidence, EvidenceSource source,
            List<DocumentExtraction> extractions) {
        for (DocumentExtraction extraction : extractions) {
            evidence.source(source, extraction.getFields());
        }
    }

    private static void copy(NormalizedExtraction from, String fromName, NormalizedExtraction.Builder to, String toName) {
        ExtractedField<?> field = from.get(fromName);
        if (field.isPresent()) {
            to.field(toName, field);
        }
    }
}
