package com.auditeng.backend.rag;

import com.auditeng.backend.config.RagProperties;
import com.auditeng.backend.dto.SearchQuery;
import com.auditeng.backend.model.Analysis;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class VoyageEmbeddingServiceTest {

    private static final int DIMENSIONS = 512;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicInteger returnedDimensions = new AtomicInteger(DIMENSIONS);
    private HttpServer server;
    private String url;

    @BeforeEach
    void startStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/embeddings", exchange -> {
            String vector = String.join(",", Collections.nCopies(returnedDimensions.get(), "0.1"));
            byte[] body = (status.get() == 200
                    ? "{\"data\":[{\"embedding\":[" + vector + "]}],\"usage\":{\"total_tokens\":7}}"
                    : "{\"detail\":\"unavailable\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/embeddings";
    }

    @AfterEach
    void stopStub() {
        server.stop(0);
    }

    private static RagProperties properties() {
        return new RagProperties("voyage-3-lite", DIMENSIONS, null, null, null, null, null, null, null, null, null);
    }

    private VoyageEmbeddingService service(String apiKey) {
        return new VoyageEmbeddingService(objectMapper, url, apiKey, properties());
    }

    @Test
    void shouldTagRemoteVectorsWithConfiguredModel() {
        // When
        EmbeddingResult result = service("key").embedDocument("grounding report");

        // Then
        assertEquals("voyage-3-lite", result.getModel());
        assertEquals(DIMENSIONS, result.getEmbedding().size());
        assertEquals(7, result.getTokensUsed());
    }

    @Test
    void shouldRefuseToEmbedDocumentsLocallyDuringOutage() {
        // Given
        status.set(503);

        // When / Then
        assertThrows(EmbeddingUnavailableException.class, () -> service("key").embedDocument("grounding report"));
    }

    @Test
    void shouldFallBackToLocalQueryEmbeddingDuringOutage() {
        // Given
        status.set(503);

        // When
        EmbeddingResult result = service("key").embedQuery("grounding report");

        // Then
        assertEquals(LocalEmbeddings.MODEL, result.getModel());
        assertEquals(DIMENSIONS, result.getEmbedding().size());
    }

    @Test
    void shouldRejectVectorsOfUnexpectedSize() {
        // Given
        returnedDimensions.set(1024);

        // When / Then
        assertThrows(EmbeddingUnavailableException.class, () -> service("key").embedDocument("grounding report"));
    }

    @Test
    void shouldEmbedLocallyWithoutApiKey() {
        // When
        EmbeddingResult document = service("").embedDocument("grounding report");
        EmbeddingResult query = service("").embedQuery("grounding report");

        // Then
        assertEquals(LocalEmbeddings.MODEL, document.getModel());
        assertEquals(document.getEmbedding(), query.getEmbedding());
    }

    @Test
    void shouldKeepAnalysisRetrievableAcrossOutage() {
        // Given
        InMemoryVectorStore store = new InMemoryVectorStore();
        RagService ragService = new RagService(service("key"), store, properties(), objectMapper);
        Analysis analysis = Analysis.builder()
                .id("an-1")
                .companyId("acme")
                .testType(TestType.GROUNDING)
                .verdict(Verdict.APPROVED)
                .build();

        // When: indexing while the provider is down, then again once it is back
        status.set(503);
        boolean indexedDuringOutage = ragService.indexAnalysis(analysis).isSuccess();
        status.set(200);
        boolean indexedAfterRecovery = ragService.indexAnalysis(analysis).isSuccess();

        // Then
        assertFalse(indexedDuringOutage);
        assertTrue(indexedAfterRecovery);
        assertEquals(1, ragService.search(SearchQuery.builder()
                .query("grounding").companyId("acme").minSimilarity(0.0).build()).size());
    }
}
