/**
 * LLM Gateway - routing, resilience, rate limiting and caching in front of LLM inference backends.
 *
 * <p>Callers submit provider-neutral inference requests; the gateway picks a backend that
 * satisfies the request's capabilities and constraints, fails over to ranked fallbacks and
 * returns a uniform response.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llm.gateway.GatewayFactory} - Main entry point for creating
 *       a fully-wired gateway from YAML configuration</li>
 *   <li>{@link fr.lapetina.llm.gateway.orchestrator.ModelGateway} - Request pipeline:
 *       rate limit, cache, route, execute with failover, record usage</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * BackendRegistry registry = new BackendRegistry();
 * registry.register(BackendDescriptor.builder()
 *         .id("llama3-8b").provider("ollama").displayName("Llama 3 8B")
 *         .capabilities(Capability.TEXT, Capability.STREAMING)
 *         .contextWindow(8192).maxOutputTokens(2048)
 *         .build());
 *
 * try (GatewayFactory factory = GatewayFactory.builder()
 *         .registry(registry)
 *         .adapter(ollamaAdapter)
 *         .build()
 *         .start()) {
 *     InferenceResponse response = factory.getGateway()
 *             .execute(InferenceRequest.ofPrompt("agent-1", "Hello!"));
 * }
 * }</pre>
 *
 * @see fr.lapetina.llm.gateway.GatewayFactory
 * @see fr.lapetina.llm.gateway.orchestrator.ModelGateway
 */
package fr.lapetina.llm.gateway;
