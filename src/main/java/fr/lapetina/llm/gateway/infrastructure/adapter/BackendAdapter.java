package fr.lapetina.llm.gateway.infrastructure.adapter;

import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.domain.model.StreamChunk;

import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Provider-specific bridge between the gateway and one inference provider.
 *
 * Adapters own prompt formatting, token counting and the wire protocol.
 * Failures surface as {@link fr.lapetina.llm.gateway.domain.exception.ProviderException},
 * either thrown or completing the returned future exceptionally.
 */
public interface BackendAdapter {

    /**
     * Provider name matching {@code BackendDescriptor.getProvider()}.
     */
    String providerName();

    /**
     * Runs a non-streaming completion on the given backend.
     */
    CompletableFuture<InferenceResponse> complete(InferenceRequest request, String backendId);

    /**
     * Opens a streamed completion. The stream must be closed by the consumer.
     */
    Stream<StreamChunk> stream(InferenceRequest request, String backendId);

    ProviderHealth healthCheck();

    boolean supportsCapability(Capability capability);

    boolean supportsModel(String backendId);
}
