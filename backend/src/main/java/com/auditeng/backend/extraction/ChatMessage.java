package com.auditeng.backend.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Chat message sent to the vision model. User messages may carry images.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String role;
    private String text;

    @Builder.Default
    private List<String> imageUrls = new ArrayList<>();

    public static ChatMessage system(String text) {
        return ChatMessage.builder().role("system").text(text).build();
    }

    public static ChatMessage user(String text, List<String> imageUrls) {
        return ChatMessage.builder()
                .role("user")
                .text(text)
                .imageUrls(imageUrls != null ? new ArrayList<>(imageUrls) : new ArrayList<>())
                .build();
    }
}
