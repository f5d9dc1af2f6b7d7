package com.auditeng.backend.dto;

import com.auditeng.backend.model.FeedbackType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * User correction of a completed analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitFeedbackRequest {

    @NotBlank
    private String userId;

    @NotNull
    private FeedbackType feedbackType;

    @Builder.Default
    private Map<String, Object> originalValue = new HashMap<>();

    @Builder.Default
    private Map<String, Object> correctedValue = new HashMap<>();

    private String explanation;
}
