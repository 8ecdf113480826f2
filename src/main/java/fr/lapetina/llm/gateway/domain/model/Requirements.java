package fr.lapetina.llm.gateway.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a backend must be able to do for a request.
 * A null preferred quality means "reasoning" when quality ranking is used.
 */
public record Requirements(Set<Capability> capabilities, int minContextLength, QualityDimension preferredQuality) {

    public static final Requirements NONE = new Requirements(Set.of(), 0, null);

    public Requirements {
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        if (minContextLength < 0) {
            throw new IllegalArgumentException("minContextLength must not be negative");
        }
    }

    public static Requirements of(Capability... capabilities) {
        return new Requirements(Set.of(capabilities), 0, null);
    }
}
