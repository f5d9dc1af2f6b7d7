package com.auditeng.backend.rag;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.KnowledgeEmbedding;
import com.auditeng.backend.model.TestType;
import com.auditeng.backend.model.Verdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Restrictions applied to a nearest-neighbour search. Null or empty criteria match everything;
 * a tenant always sees its own entries plus global ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorFilter {

    @Builder.Default
    private List<ContentType> contentTypes = new ArrayList<>();

    private TestType testType;
    private Verdict verdict;
    private String companyId;

    /** When set, only entries embedded by this model are compared. */
    private String embeddingModel;

    /** Skip entries that feedback marked as incorrect. */
    @Builder.Default
    private boolean onlyCorrect = true;

    public boolean matches(KnowledgeEmbedding entry) {
        if (contentTypes != null && !contentTypes.isEmpty() && !contentTypes.contains(entry.getContentType())) {
            return false;
        }
        if (testType != null && testType != entry.getTestType()) {
            return false;
        }
        if (verdict != null && verdict != entry.getVerdict()) {
            return false;
        }
        if (embeddingModel != null && !embeddingModel.equals(entry.getEmbeddingModel())) {
            return false;
        }
        if (entry.getCompanyId() != null && !Objects.equals(entry.getCompanyId(), companyId)) {
            return false;
        }
        return !onlyCorrect || entry.isWasCorrect();
    }
}
