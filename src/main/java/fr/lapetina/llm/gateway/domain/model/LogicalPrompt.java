package fr.lapetina.llm.gateway.domain.model;

import java.util.List;

/**
 * Provider-neutral prompt: ordered messages, optional system text and generation parameters.
 */
public record LogicalPrompt(List<Message> messages, String systemPrompt, GenerationParameters parameters) {
    public LogicalPrompt {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        messages = List.copyOf(messages);
        if (parameters == null) {
            parameters = GenerationParameters.DEFAULT;
        }
    }

    /**
     * Total character count of system text and message contents.
     */
    public int characterCount() {
        int count = systemPrompt != null ? systemPrompt.length() : 0;
        for (Message message : messages) {
            count += message.content().length();
        }
        return count;
    }
}
