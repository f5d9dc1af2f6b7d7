package com.auditeng.backend.rag;

import com.auditeng.backend.model.ContentType;
import com.auditeng.backend.model.TestType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One section of a technical standard or best-practice guide from the bundled catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StandardDocument {
    private String name;
    private String section;
    private String content;

    @Builder.Default
    private ContentType contentType = ContentType.TECHNICAL_STANDARD;

    @Builder.Default
    private List<TestType> testTypes = new ArrayList<>();
}
