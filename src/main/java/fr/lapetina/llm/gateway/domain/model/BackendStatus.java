package fr.lapetina.llm.gateway.domain.model;

/**
 * Lifecycle status of a registered backend.
 */
public enum BackendStatus {
    /** Eligible for routing */
    ACTIVE,

    /** Still callable by explicit id, excluded from capability listings */
    DEPRECATED,

    /** Not callable */
    DISABLED
}
