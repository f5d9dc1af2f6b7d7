package com.auditeng.backend.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text and token usage of one vision model response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletion {
    private String content;
    private int promptTokens;
    private int completionTokens;
    private String model;
}
