package me.growmies.assistant.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One role-tagged message within a session or a context window.
 */
@Value
@Builder
public class Turn {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String role;
    String content;
    Instant timestamp;

    /** Image urls attached to a user turn; only sent with the latest turn. */
    @Builder.Default
    List<String> imageUrls = List.of();

    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }

    public static Turn system(String content) {
        return Turn.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public Turn withContent(String newContent) {
        return Turn.builder()
                .role(role)
                .content(newContent)
                .timestamp(timestamp)
                .imageUrls(imageUrls)
                .build();
    }

    public Turn withImageUrls(List<String> urls) {
        return Turn.builder()
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .imageUrls(urls != null ? List.copyOf(urls) : List.of())
                .build();
    }
}
