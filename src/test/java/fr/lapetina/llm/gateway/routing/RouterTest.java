package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.exception.RoutingException;
import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.Constraints;
import fr.lapetina.llm.gateway.domain.model.GenerationParameters;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.Requirements;
import fr.lapetina.llm.gateway.domain.model.RoutingDecision;
import fr.lapetina.llm.gateway.domain.strategy.RoutingStrategy;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreakerRegistry;
import fr.lapetina.llm.gateway.support.Backends;
import fr.lapetina.llm.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    private BackendRegistry registry;
    private CircuitBreakerRegistry breakers;
    private Router router;

    @BeforeEach
    void setUp() {
        registry = new BackendRegistry();
        registry.register(Backends.gpt4o());
        registry.register(Backends.gpt4oMini());
        registry.register(Backends.claudeSonnet());
        registry.register(Backends.llamaLocal());

        breakers = new CircuitBreakerRegistry(3, Duration.ofSeconds(30), 1, new MutableClock());
        router = new Router(registry, breakers, TokenEstimator.characterRatio(), RoutingStrategy.COST_OPTIMIZED, 2);
    }

    private static InferenceRequest.Builder request() {
        return InferenceRequest.builder()
                .callerId("team-a")
                .messages(List.of(Message.user("Hello")));
    }

    private static RoutingException routingFailure(Runnable routing) {
        try {
            routing.run();
        } catch (RoutingException e) {
            return e;
        }
        throw new AssertionError("Expected a routing failure");
    }

    @Nested
    @DisplayName("Decision shape")
    class DecisionTests {

        @Test
        @DisplayName("should pick the cheapest backend and bound the fallbacks")
        void shouldPickCheapest() {
            RoutingDecision decision = router.route(request().build());

            assertThat(decision.primaryBackendId()).isEqualTo("llama-local");
            assertThat(decision.primaryProvider()).isEqualTo("ollama");
            assertThat(decision.fallbackBackendIds()).containsExactly("gpt-4o-mini", "claude-sonnet");
            assertThat(decision.candidateCount()).isEqualTo(4);
            assertThat(decision.strategy()).isEqualTo(RoutingStrategy.COST_OPTIMIZED);
            assertThat(decision.estimatedLatencyMs()).isEqualTo(1500);
        }

        @Test
        @DisplayName("should explain the selection")
        void shouldExplainSelection() {
            RoutingDecision decision = router.route(request().build());

            assertThat(decision.reason())
                    .isEqualTo("Selected Llama 3 8B (llama-local) from ollama using cost-optimized strategy");
        }

        @Test
        @DisplayName("should return no fallbacks when a single backend qualifies")
        void shouldReturnSingleCandidate() {
            InferenceRequest vision = request()
                    .requirements(Requirements.of(Capability.VISION))
                    .constraints(Constraints.builder().excludedBackends(Set.of("claude-sonnet")).build())
                    .build();

            RoutingDecision decision = router.route(vision);

            assertThat(decision.primaryBackendId()).isEqualTo("gpt-4o");
            assertThat(decision.fallbackBackendIds()).isEmpty();
            assertThat(decision.candidateCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should estimate input tokens at four characters each")
        void shouldEstimateInputTokens() {
            InferenceRequest longPrompt = InferenceRequest.ofPrompt("team-a", "x".repeat(400));

            assertThat(router.route(longPrompt).estimatedInputTokens()).isEqualTo(100);
            assertThat(router.estimateInputTokens(InferenceRequest.ofPrompt("team-a", "Hi"))).isEqualTo(1);
        }

        @Test
        @DisplayName("should route identically for identical inputs")
        void shouldBeDeterministic() {
            InferenceRequest request = request().requirements(Requirements.of(Capability.TOOL_USE)).build();

            RoutingDecision first = router.route(request, RoutingStrategy.QUALITY_OPTIMIZED);
            RoutingDecision second = router.route(request, RoutingStrategy.QUALITY_OPTIMIZED);

            assertThat(second.attemptOrder()).isEqualTo(first.attemptOrder());
            assertThat(first.attemptOrder()).containsExactly("claude-sonnet", "gpt-4o", "gpt-4o-mini");
        }

        @Test
        @DisplayName("should use a changed default strategy")
        void shouldUseChangedDefault() {
            router.setDefaultStrategy(RoutingStrategy.LATENCY_OPTIMIZED);

            RoutingDecision decision = router.route(request().build());

            assertThat(router.getDefaultStrategy()).isEqualTo(RoutingStrategy.LATENCY_OPTIMIZED);
            assertThat(decision.primaryBackendId()).isEqualTo("gpt-4o-mini");
            assertThat(decision.fallbackBackendIds()).containsExactly("gpt-4o", "claude-sonnet");
        }
    }

    @Nested
    @DisplayName("Hard filters")
    class HardFilterTests {

        @Test
        @DisplayName("should fail at the capability stage")
        void shouldFailOnCapability() {
            InferenceRequest json = request().requirements(Requirements.of(Capability.JSON_MODE)).build();

            RoutingException e = routingFailure(() -> router.route(json));

            assertThat(e.getCode()).isEqualTo(ErrorCode.NO_CAPABLE_BACKEND);
            assertThat(e.getStage()).isEqualTo("capability");
        }

        @Test
        @DisplayName("should require streaming when the constraints demand it")
        void shouldRequireStreaming() {
            InferenceRequest streaming = request()
                    .constraints(Constraints.builder().streamingRequired(true).build())
                    .build();

            assertThat(router.route(streaming).attemptOrder()).doesNotContain("llama-local");
        }

        @Test
        @DisplayName("should drop backends whose window cannot hold prompt plus output")
        void shouldFilterOnContextWindow() {
            InferenceRequest longOutput = request()
                    .parameters(new GenerationParameters(0.7, 10_000, null))
                    .build();

            assertThat(router.route(longOutput).primaryBackendId()).isEqualTo("gpt-4o-mini");
        }

        @Test
        @DisplayName("should fail at the context-length stage")
        void shouldFailOnContextLength() {
            InferenceRequest huge = request()
                    .requirements(new Requirements(Set.of(), 500_000, null))
                    .build();

            RoutingException e = routingFailure(() -> router.route(huge));

            assertThat(e.getCode()).isEqualTo(ErrorCode.CONTEXT_LENGTH_EXCEEDED);
            assertThat(e.getStage()).isEqualTo("context-length");
        }

        @Test
        @DisplayName("should keep only backends in allowed regions")
        void shouldFilterOnRegion() {
            InferenceRequest eu = request()
                    .requirements(Requirements.of(Capability.TOOL_USE))
                    .constraints(Constraints.builder().allowedRegions(Set.of("eu")).build())
                    .build();

            assertThat(router.route(eu).attemptOrder()).containsExactly("claude-sonnet", "gpt-4o");
        }

        @Test
        @DisplayName("should fail at the data-residency stage")
        void shouldFailOnResidency() {
            InferenceRequest apac = request()
                    .requirements(Requirements.of(Capability.TOOL_USE))
                    .constraints(Constraints.builder().allowedRegions(Set.of("ap-southeast")).build())
                    .build();

            RoutingException e = routingFailure(() -> router.route(apac));

            assertThat(e.getCode()).isEqualTo(ErrorCode.DATA_RESIDENCY_VIOLATION);
            assertThat(e.getStage()).isEqualTo("data-residency");
        }

        @Test
        @DisplayName("should skip backends with an open circuit")
        void shouldSkipOpenCircuits() {
            breakers.forceOpen("llama-local");

            RoutingDecision decision = router.route(request().build());

            assertThat(decision.primaryBackendId()).isEqualTo("gpt-4o-mini");
            assertThat(decision.attemptOrder()).doesNotContain("llama-local");
        }

        @Test
        @DisplayName("should fail at the health stage when every circuit is open")
        void shouldFailWhenAllOpen() {
            breakers.forceOpen("gpt-4o");
            breakers.forceOpen("claude-sonnet");
            InferenceRequest vision = request().requirements(Requirements.of(Capability.VISION)).build();

            RoutingException e = routingFailure(() -> router.route(vision));

            assertThat(e.getCode()).isEqualTo(ErrorCode.ALL_BACKENDS_UNHEALTHY);
            assertThat(e.getStage()).isEqualTo("health");
        }

        @Test
        @DisplayName("should report the stage in the exception message")
        void shouldDescribeStage() {
            InferenceRequest json = request().requirements(Requirements.of(Capability.JSON_MODE)).build();

            assertThatThrownBy(() -> router.route(json))
                    .isInstanceOf(RoutingException.class)
                    .hasMessageContaining("stage=capability");
        }
    }

    @Nested
    @DisplayName("Soft preferences")
    class PreferenceTests {

        @Test
        @DisplayName("should keep only backends within the latency ceiling")
        void shouldApplyLatencyCeiling() {
            InferenceRequest fast = request()
                    .constraints(Constraints.builder().maxLatencyMs(1600L).build())
                    .build();

            RoutingDecision decision = router.route(fast);

            assertThat(decision.attemptOrder()).containsExactly("gpt-4o-mini");
        }

        @Test
        @DisplayName("should ignore the latency ceiling when nothing meets it")
        void shouldRelaxLatencyCeiling() {
            InferenceRequest impossible = request()
                    .constraints(Constraints.builder().maxLatencyMs(100L).build())
                    .build();

            assertThat(router.route(impossible).candidateCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should move preferred backends to the front in preference order")
        void shouldHonorPreferredBackends() {
            InferenceRequest preferring = request()
                    .constraints(Constraints.builder().preferredBackends(List.of("gpt-4o", "claude-sonnet")).build())
                    .build();

            assertThat(router.route(preferring).attemptOrder())
                    .containsExactly("gpt-4o", "claude-sonnet", "llama-local");
        }

        @Test
        @DisplayName("should rank over-budget backends after those within budget")
        void shouldDemoteOverBudget() {
            InferenceRequest budgeted = request()
                    .constraints(Constraints.builder().maxCostUsd(0.001).build())
                    .build();

            RoutingDecision decision = router.route(budgeted, RoutingStrategy.QUALITY_OPTIMIZED);

            assertThat(decision.attemptOrder()).containsExactly("gpt-4o-mini", "llama-local", "claude-sonnet");
        }

        @Test
        @DisplayName("should restrict to pinned providers")
        void shouldPinProvider() {
            InferenceRequest pinned = request()
                    .constraints(Constraints.builder().preferredProviders(List.of("anthropic")).build())
                    .build();

            RoutingDecision decision = router.route(pinned, RoutingStrategy.PROVIDER_PINNED);

            assertThat(decision.primaryBackendId()).isEqualTo("claude-sonnet");
            assertThat(decision.fallbackBackendIds()).isEmpty();
        }
    }
}
