package fr.lapetina.llm.gateway.integration;

import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.InferenceResponse;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.Priority;
import fr.lapetina.llm.gateway.domain.model.UsageRecord;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.orchestrator.GatewayHealth;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of a gateway wired by the factory.
 * Configuration is externalized to test-config.yaml.
 */
class GatewayIntegrationTest {

    private TestGatewayFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestGatewayFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static InferenceRequest uncached(String text) {
        return InferenceRequest.builder()
                .callerId("team-a")
                .messages(List.of(Message.user(text)))
                .cacheEnabled(false)
                .build();
    }

    @Test
    @DisplayName("should route to the cheapest backend and publish usage")
    void shouldRouteToCheapestBackend() throws Exception {
        InferenceResponse response = factory.getGateway().execute(InferenceRequest.ofPrompt("team-a", "Say hello"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.backendId()).isEqualTo("llama-local");
        assertThat(response.content()).isEqualTo("Response from llama-local");

        List<UsageRecord> usage = factory.awaitUsage(1);
        assertThat(usage).singleElement().satisfies(record -> {
            assertThat(record.callerId()).isEqualTo("team-a");
            assertThat(record.backendId()).isEqualTo("llama-local");
            assertThat(record.cached()).isFalse();
        });
    }

    @Test
    @DisplayName("should answer a repeated prompt from the cache")
    void shouldServeRepeatFromCache() {
        InferenceResponse first = factory.getGateway().execute(InferenceRequest.ofPrompt("team-a", "Capital of France?"));
        InferenceResponse second = factory.getGateway().execute(InferenceRequest.ofPrompt("team-b", "Capital of France?"));

        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.content()).isEqualTo(first.content());
        assertThat(factory.ollama().getCalls()).hasSize(1);
        assertThat(factory.getCache().stats().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("should fail over and then skip a backend whose circuit opened")
    void shouldOpenCircuitAfterRepeatedFailures() {
        factory.ollama().failing("llama-local");

        InferenceResponse first = factory.getGateway().execute(uncached("one"));
        InferenceResponse second = factory.getGateway().execute(uncached("two"));

        assertThat(first.backendId()).isEqualTo("gpt-4o-mini");
        assertThat(second.backendId()).isEqualTo("gpt-4o-mini");
        assertThat(factory.getCircuitBreakers().getState("llama-local")).isEqualTo(CircuitBreaker.State.OPEN);

        InferenceResponse third = factory.getGateway().execute(uncached("three"));

        assertThat(third.backendId()).isEqualTo("gpt-4o-mini");
        assertThat(factory.ollama().getCalls()).hasSize(2);
        assertThat(factory.getGateway().health().status()).isEqualTo(GatewayHealth.Status.DEGRADED);
    }

    @Test
    @DisplayName("should process queued requests through the admission workers")
    void shouldProcessQueuedRequests() throws Exception {
        List<CompletableFuture<InferenceResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(factory.getGateway().submit(uncached("queued " + i), Priority.NORMAL));
        }

        for (CompletableFuture<InferenceResponse> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        }
        assertThat(factory.awaitUsage(5)).hasSize(5);
    }

    @Test
    @DisplayName("should expose gateway meters in the scrape")
    void shouldExposeMeters() {
        factory.getGateway().execute(uncached("Hello"));

        String scrape = factory.getMetricsRegistry().scrape();

        assertThat(scrape)
                .contains("llm_gateway_test_requests_total")
                .contains("llm_gateway_test_circuit_state{backend=\"llama-local\"")
                .contains("llm_gateway_test_queue_size");
    }

    @Test
    @DisplayName("should report a healthy gateway when every provider answers")
    void shouldReportHealthy() {
        GatewayHealth health = factory.getGateway().health();

        assertThat(health.status()).isEqualTo(GatewayHealth.Status.HEALTHY);
        assertThat(health.providers()).containsOnlyKeys("openai", "anthropic", "ollama");
        assertThat(health.registry().totalBackends()).isEqualTo(4);
        assertThat(factory.getHealthMonitor()).isNull();
    }
}
