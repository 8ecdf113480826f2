package fr.lapetina.llm.gateway.domain.model;

/**
 * Admission priority tiers. Lower ordinal is served first.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW
}
