package fr.lapetina.llm.gateway.domain.model;

import java.util.Locale;

/**
 * Task categories a backend is scored on.
 */
public enum QualityDimension {
    REASONING,
    CODING,
    CREATIVE,
    SUMMARIZATION;

    public static QualityDimension fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
