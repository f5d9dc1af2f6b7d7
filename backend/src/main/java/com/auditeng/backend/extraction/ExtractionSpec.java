package com.auditeng.backend.extraction;

import java.util.List;

/**
 * Describes one kind of extraction: prompts to send, images to attach and how to read the reply.
 *
 * @param <I> input type
 * @param <T> parsed result type
 */
public interface ExtractionSpec<I, T> {

    String name();

    String buildSystemPrompt(I input);

    String buildUserPrompt(I input);

    /**
     * Images to attach, already prepared as URLs or data URLs.
     */
    List<String> images(I input);

    /**
     * Parses the raw model reply. Malformed fields must degrade to not-found values.
     *
     * @throws MalformedResponseException when the reply is not JSON at all
     */
    T parseResponse(String content);
}
