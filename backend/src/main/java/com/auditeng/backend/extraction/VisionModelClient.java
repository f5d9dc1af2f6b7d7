package com.auditeng.backend.extraction;

import java.util.List;

/**
 * Provider-facing port for a multimodal chat completion.
 */
public interface VisionModelClient {

    /**
     * Sends one chat completion request asking for a JSON object response.
     *
     * @throws VisionModelException when the provider rejects or fails the request
     */
    ChatCompletion complete(List<ChatMessage> messages, String model, VisionDetail detail,
            int maxTokens, double temperature) throws VisionModelException;
}
