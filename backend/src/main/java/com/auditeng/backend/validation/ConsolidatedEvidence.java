package com.auditeng.backend.validation;

import com.auditeng.backend.model.NormalizedExtraction;
import com.auditeng.backend.model.TestType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extracted values of one report grouped by the source they were read from.
 */
public final class ConsolidatedEvidence {

    private final TestType testType;
    private final Map<EvidenceSource, NormalizedExtraction> sources;
    private final Map<EvidenceSource, List<NormalizedExtraction>> documents;

    private ConsolidatedEvidence(TestType testType, Map<EvidenceSource, NormalizedExtraction> sources,
            Map<EvidenceSource, List<NormalizedExtraction>> documents) {
        this.testType = testType;
        this.sources = Collections.unmodifiableMap(new EnumMap<>(sources));
        Map<EvidenceSource, List<NormalizedExtraction>> copy = new EnumMap<>(EvidenceSource.class);
        documents.forEach((source, list) -> copy.put(source, List.copyOf(list)));
        this.documents = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(TestType testType) {
        return new Builder(testType);
    }

    public TestType testType() {
        return testType;
    }

    public NormalizedExtraction get(EvidenceSource source) {
        return sources.getOrDefault(source, NormalizedExtraction.empty());
    }

    /**
     * The values of each document read for a source, in input order, before merging.
     */
    public List<NormalizedExtraction> documents(EvidenceSource source) {
        return documents.getOrDefault(source, List.of());
    }

    public Map<EvidenceSource, NormalizedExtraction> sources() {
        return sources;
    }

    /**
     * All sources folded into one extraction in {@link EvidenceSource} order.
     */
    public NormalizedExtraction merged() {
        NormalizedExtraction merged = NormalizedExtraction.empty();
        for (NormalizedExtraction extraction : sources.values()) {
            merged = merged.merge(extraction);
        }
        return merged;
    }

    public static final class Builder {
        private final TestType testType;
        private final Map<EvidenceSource, NormalizedExtraction> sources = new EnumMap<>(EvidenceSource.class);
        private final Map<EvidenceSource, List<NormalizedExtraction>> documents = new EnumMap<>(EvidenceSource.class);

        private Builder(TestType testType) {
            this.testType = testType;
        }

        /**
         * Adds values for a source, merging with anything it already holds.
         */
        public Builder source(EvidenceSource source, NormalizedExtraction extraction) {
            if (extraction != null && !extraction.isEmpty()) {
                sources.merge(source, extraction, NormalizedExtraction::merge);
                documents.computeIfAbsent(source, key -> new ArrayList<>()).add(extraction);
            }
            return this;
        }

        public ConsolidatedEvidence build() {
            return new ConsolidatedEvidence(testType, sources, documents);
        }
    }
}
