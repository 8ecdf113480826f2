package fr.lapetina.llm.gateway.domain.model;

import java.util.Objects;

/**
 * One turn of a conversation.
 */
public record Message(String role, String content) {
    public Message {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
    }

    public static Message user(String content) {
        return new Message("user", content);
    }

    public static Message assistant(String content) {
        return new Message("assistant", content);
    }
}
