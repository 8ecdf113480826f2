package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.Constraints;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.Message;
import fr.lapetina.llm.gateway.domain.model.QualityDimension;
import fr.lapetina.llm.gateway.domain.model.Requirements;
import fr.lapetina.llm.gateway.support.Backends;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RankingStrategyTest {

    private List<BackendDescriptor> candidates;
    private RoutingContext context;

    @BeforeEach
    void setUp() {
        candidates = List.of(
                Backends.gpt4o(),
                Backends.gpt4oMini(),
                Backends.claudeSonnet(),
                Backends.llamaLocal()
        );
        context = contextFor(InferenceRequest.ofPrompt("team-a", "Hello"));
    }

    private static RoutingContext contextFor(InferenceRequest request) {
        return new RoutingContext(request, 1);
    }

    private static List<String> ids(List<BackendDescriptor> ranked) {
        return ranked.stream().map(BackendDescriptor::getId).toList();
    }

    @Nested
    @DisplayName("CostOptimizedStrategy")
    class CostOptimizedTests {

        private final RankingStrategy strategy = new CostOptimizedStrategy();

        @Test
        @DisplayName("should rank cheapest first with provisioned throughput as free")
        void shouldRankByCost() {
            assertThat(ids(strategy.rank(candidates, context)))
                    .containsExactly("llama-local", "gpt-4o-mini", "claude-sonnet", "gpt-4o");
        }

        @Test
        @DisplayName("should break equal cost on backend id")
        void shouldBreakTiesOnId() {
            List<BackendDescriptor> tied = List.of(
                    Backends.text("zeta", "p1", 1.0),
                    Backends.text("alpha", "p2", 1.0),
                    Backends.text("mid", "p3", 1.0)
            );

            assertThat(ids(strategy.rank(tied, context))).containsExactly("alpha", "mid", "zeta");
        }

        @Test
        @DisplayName("should not depend on input order")
        void shouldIgnoreInputOrder() {
            List<BackendDescriptor> shuffled = new ArrayList<>(candidates);
            Collections.reverse(shuffled);

            assertThat(strategy.rank(shuffled, context)).isEqualTo(strategy.rank(candidates, context));
        }
    }

    @Nested
    @DisplayName("LatencyOptimizedStrategy")
    class LatencyOptimizedTests {

        @Test
        @DisplayName("should rank by declared median latency")
        void shouldRankByLatency() {
            assertThat(ids(new LatencyOptimizedStrategy().rank(candidates, context)))
                    .containsExactly("gpt-4o-mini", "gpt-4o", "claude-sonnet", "llama-local");
        }
    }

    @Nested
    @DisplayName("QualityOptimizedStrategy")
    class QualityOptimizedTests {

        private final RankingStrategy strategy = new QualityOptimizedStrategy();

        @Test
        @DisplayName("should rank on reasoning when no dimension is preferred")
        void shouldDefaultToReasoning() {
            assertThat(ids(strategy.rank(candidates, context)))
                    .containsExactly("claude-sonnet", "gpt-4o", "gpt-4o-mini", "llama-local");
        }

        @Test
        @DisplayName("should rank on the preferred dimension, unscored backends last")
        void shouldRankOnPreferredDimension() {
            InferenceRequest coding = InferenceRequest.builder()
                    .callerId("team-a")
                    .messages(List.of(Message.user("Refactor this")))
                    .requirements(new Requirements(Set.of(Capability.TEXT), 0, QualityDimension.CODING))
                    .build();

            assertThat(ids(strategy.rank(candidates, contextFor(coding))))
                    .containsExactly("claude-sonnet", "gpt-4o", "gpt-4o-mini", "llama-local");
        }
    }

    @Nested
    @DisplayName("ProviderPinnedStrategy")
    class ProviderPinnedTests {

        private final RankingStrategy strategy = new ProviderPinnedStrategy();

        private RoutingContext pinnedTo(String... providers) {
            return contextFor(InferenceRequest.builder()
                    .callerId("team-a")
                    .messages(List.of(Message.user("Hello")))
                    .constraints(Constraints.builder().preferredProviders(List.of(providers)).build())
                    .build());
        }

        @Test
        @DisplayName("should keep preferred providers in preference order, cheapest first within each")
        void shouldKeepPreferredProviders() {
            assertThat(ids(strategy.rank(candidates, pinnedTo("openai", "anthropic"))))
                    .containsExactly("gpt-4o-mini", "gpt-4o", "claude-sonnet");
        }

        @Test
        @DisplayName("should fall back to every candidate by cost when no provider matches")
        void shouldFallBackWhenNoMatch() {
            assertThat(ids(strategy.rank(candidates, pinnedTo("mistral"))))
                    .containsExactly("llama-local", "gpt-4o-mini", "claude-sonnet", "gpt-4o");
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class StrategyFactoryTests {

        @Test
        @DisplayName("should create one strategy per type")
        void shouldCreateAll() {
            var all = StrategyFactory.createAll();

            assertThat(all).containsOnlyKeys(RoutingStrategy.values());
            all.forEach((type, strategy) -> assertThat(strategy.getType()).isEqualTo(type));
        }

        @Test
        @DisplayName("should rank capability-first like cost")
        void shouldRankCapabilityFirstByCost() {
            RankingStrategy capabilityFirst = StrategyFactory.create(RoutingStrategy.CAPABILITY_FIRST);

            assertThat(capabilityFirst.rank(candidates, context))
                    .isEqualTo(new CostOptimizedStrategy().rank(candidates, context));
        }

        @Test
        @DisplayName("should resolve names and fall back on unknown ones")
        void shouldResolveNames() {
            assertThat(StrategyFactory.resolveOrDefault("latency-optimized", RoutingStrategy.COST_OPTIMIZED))
                    .isEqualTo(RoutingStrategy.LATENCY_OPTIMIZED);
            assertThat(StrategyFactory.resolveOrDefault("QUALITY_OPTIMIZED", RoutingStrategy.COST_OPTIMIZED))
                    .isEqualTo(RoutingStrategy.QUALITY_OPTIMIZED);
            assertThat(StrategyFactory.resolveOrDefault("round-robin", RoutingStrategy.COST_OPTIMIZED))
                    .isEqualTo(RoutingStrategy.COST_OPTIMIZED);
            assertThat(StrategyFactory.resolveOrDefault(null, RoutingStrategy.CAPABILITY_FIRST))
                    .isEqualTo(RoutingStrategy.CAPABILITY_FIRST);
        }

        @Test
        @DisplayName("should reject unknown names when parsed strictly")
        void shouldRejectUnknownNames() {
            assertThatThrownBy(() -> RoutingStrategy.fromName("round-robin"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("round-robin");
        }
    }
}
