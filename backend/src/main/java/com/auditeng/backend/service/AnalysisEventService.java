package com.auditeng.backend.service;

import com.auditeng.backend.model.AnalysisEvent;
import com.auditeng.backend.model.AnalysisEventType;
import com.auditeng.backend.repository.AnalysisEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Records the activity trail of each analysis.
 */
@Service
public class AnalysisEventService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEventService.class);

    private final AnalysisEventRepository analysisEventRepository;

    public AnalysisEventService(AnalysisEventRepository analysisEventRepository) {
        this.analysisEventRepository = analysisEventRepository;
    }

    /**
     * Append an event to the trail. A failed write is logged and never interrupts the caller.
     */
    public AnalysisEvent record(String analysisId, AnalysisEventType type, String title,
            String content, Map<String, Object> metadata) {
        log.debug("[PIPELINE] Event for analysis: {} | Type: {} | Title: {}", analysisId, type, title);

        AnalysisEvent event = AnalysisEvent.builder()
                .analysisId(analysisId)
                .type(type)
                .title(title)
                .content(content)
                .metadata(metadata != null ? metadata : Map.of())
                .build();
        try {
            return analysisEventRepository.save(event);
        } catch (RuntimeException e) {
            log.warn("[PIPELINE] Failed to record {} event for analysis {}: {}", type, analysisId, e.getMessage());
            return event;
        }
    }

    public AnalysisEvent record(String analysisId, AnalysisEventType type, String title) {
        return record(analysisId, type, title, null, null);
    }

    /**
     * Get all events for an analysis in chronological order.
     */
    public List<AnalysisEvent> getEvents(String analysisId) {
        return analysisEventRepository.findByAnalysisIdOrderByCreatedAtAsc(analysisId);
    }

    public List<AnalysisEvent> getEvents(String analysisId, AnalysisEventType type) {
        return analysisEventRepository.findByAnalysisIdAndTypeOrderByCreatedAtAsc(analysisId, type);
    }
}
