package com.auditeng.backend.rag;

import com.auditeng.backend.config.RagProperties;
import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.KnowledgeEmbedding;
import com.auditeng.backend.repository.KnowledgeEmbeddingRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Vector store on MongoDB Atlas. Requires a vector search index (see {@link RagProperties#vectorIndex()})
 * on {@code knowledge_embeddings.embedding} with cosine similarity and filter fields
 * contentType, testType, verdict, companyId, wasCorrect and embeddingModel. The index dimension must
 * equal {@link RagProperties#embeddingDimensions()}.
 */
@Component
@ConditionalOnProperty(name = "auditeng.rag.vector-store", havingValue = "atlas", matchIfMissing = true)
public class MongoVectorStore implements VectorStore {

    private static final Logger log = LoggerFactory.getLogger(MongoVectorStore.class);

    static final String COLLECTION = "knowledge_embeddings";

    private final KnowledgeEmbeddingRepository repository;
    private final MongoTemplate mongoTemplate;
    private final RagProperties properties;

    public MongoVectorStore(KnowledgeEmbeddingRepository repository, MongoTemplate mongoTemplate,
            RagProperties properties) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
        this.properties = properties;
    }

    @Override
    public KnowledgeEmbedding insert(KnowledgeEmbedding entry) {
        return repository.save(entry);
    }

    @Override
    public List<ScoredEmbedding> nearest(List<Double> query, int k, VectorFilter filter) {
        Document vectorSearchStage = new Document("$vectorSearch",
                new Document()
                        .append("index", properties.vectorIndex())
                        .append("path", "embedding")
                        .append("queryVector", query)
                        .append("numCandidates", k * 10)
                        .append("limit", k)
                        .append("filter", toAtlasFilter(filter)));
        Document projectStage = new Document("$addFields",
                new Document("score", new Document("$meta", "vectorSearchScore")));

        List<ScoredEmbedding> results = mongoTemplate.getCollection(COLLECTION)
                .aggregate(List.of(vectorSearchStage, projectStage), Document.class)
                .map(doc -> {
                    double score = doc.get("score", Number.class).doubleValue();
                    KnowledgeEmbedding entry = mongoTemplate.getConverter().read(KnowledgeEmbedding.class, doc);
                    // Atlas reports cosine as (1 + cos) / 2
                    return new ScoredEmbedding(entry, 2 * score - 1);
                })
                .into(new ArrayList<>());

        log.debug("[RAG] Vector search returned {} entries", results.size());
        return results;
    }

    static Document toAtlasFilter(VectorFilter filter) {
        List<Document> clauses = new ArrayList<>();
        if (filter.getContentTypes() != null && !filter.getContentTypes().isEmpty()) {
            clauses.add(new Document("contentType", new Document("$in",
                    filter.getContentTypes().stream().map(Enum::name).collect(Collectors.toList()))));
        }
        if (filter.getTestType() != null) {
            clauses.add(new Document("testType", new Document("$eq", filter.getTestType().name())));
        }
        if (filter.getVerdict() != null) {
            clauses.add(new Document("verdict", new Document("$eq", filter.getVerdict().name())));
        }
        if (filter.getEmbeddingModel() != null) {
            clauses.add(new Document("embeddingModel", new Document("$eq", filter.getEmbeddingModel())));
        }
        if (filter.isOnlyCorrect()) {
            clauses.add(new Document("wasCorrect", new Document("$eq", true)));
        }
        List<Document> tenant = new ArrayList<>();
        tenant.add(new Document("companyId", new Document("$eq", null)));
        if (filter.getCompanyId() != null) {
            tenant.add(new Document("companyId", new Document("$eq", filter.getCompanyId())));
        }
        clauses.add(new Document("$or", tenant));
        return new Document("$and", clauses);
    }

    @Override
    public void incrementUseCount(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        mongoTemplate.updateMulti(
                Query.query(Criteria.where("_id").in(ids)),
                new Update().inc("useCount", 1).set("updatedAt", Instant.now()),
                KnowledgeEmbedding.class);
    }

    @Override
    public void markIncorrect(String id) {
        mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(id)),
                new Update().set("wasCorrect", false).set("updatedAt", Instant.now()),
                KnowledgeEmbedding.class);
    }

    @Override
    public List<KnowledgeEmbedding> findByAnalysisId(String analysisId, ContentType contentType) {
        return repository.findByAnalysisIdAndContentType(analysisId, contentType);
    }

    @Override
    public long countByContentType(ContentType contentType) {
        return repository.countByContentType(contentType);
    }
}
