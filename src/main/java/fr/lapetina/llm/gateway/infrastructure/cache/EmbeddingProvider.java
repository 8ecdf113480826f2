package fr.lapetina.llm.gateway.infrastructure.cache;

/**
 * Produces the similarity vector of a request's text.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * @throws RuntimeException if the embedding cannot be produced
     */
    float[] embed(String text);
}
