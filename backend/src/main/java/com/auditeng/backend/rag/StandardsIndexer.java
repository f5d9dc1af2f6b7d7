package com.auditeng.backend.rag;

import com.auditeng.backend.config.RagProperties;
import com.auditeng.backend.dto.IndexResult;
import com.auditeng.backend.model.ContentType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Indexes the bundled catalog of technical standards and best practices as global knowledge.
 */
@Component
public class StandardsIndexer {

    private static final Logger log = LoggerFactory.getLogger(StandardsIndexer.class);

    static final String CATALOG = "standards/technical-standards.json";

    private final RagService ragService;
    private final VectorStore vectorStore;
    private final RagProperties properties;
    private final ObjectMapper objectMapper;

    public StandardsIndexer(RagService ragService, VectorStore vectorStore, RagProperties properties,
            ObjectMapper objectMapper) {
        this.ragService = ragService;
        this.vectorStore = vectorStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedOnStartup() {
        if (!properties.seedStandards()) {
            return;
        }
        try {
            if (vectorStore.countByContentType(ContentType.TECHNICAL_STANDARD) > 0) {
                log.debug("[RAG] Standards already indexed");
                return;
            }
            int indexed = indexCatalog();
            log.info("[RAG] Seeded {} standard entries", indexed);
        } catch (IOException | RuntimeException e) {
            log.error("[RAG] Failed to seed standards catalog: {}", e.getMessage());
        }
    }

    /**
     * @return number of entries stored
     */
    public int indexCatalog() throws IOException {
        int indexed = 0;
        for (StandardDocument standard : loadCatalog()) {
            indexed += (int) ragService.indexStandard(standard).stream().filter(IndexResult::isSuccess).count();
        }
        return indexed;
    }

    public List<StandardDocument> loadCatalog() throws IOException {
        try (InputStream in = new ClassPathResource(CATALOG).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<StandardDocument>>() {
            });
        }
    }
}
