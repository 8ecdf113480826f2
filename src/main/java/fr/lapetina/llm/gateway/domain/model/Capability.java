package fr.lapetina.llm.gateway.domain.model;

import java.util.Locale;

/**
 * Capabilities a backend may declare and a request may require.
 */
public enum Capability {
    TEXT("text"),
    VISION("vision"),
    TOOL_USE("tool-use"),
    STREAMING("streaming"),
    JSON_MODE("json-mode"),
    EMBEDDINGS("embeddings");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Parses a capability from its wire name ("vision", "tool-use") or enum name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Capability fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Capability capability : values()) {
            if (capability.wireName.equals(normalized)) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown capability: " + name);
    }
}
