package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.exception.ErrorCode;
import fr.lapetina.llm.gateway.domain.exception.RoutingException;
import fr.lapetina.llm.gateway.domain.model.BackendDescriptor;
import fr.lapetina.llm.gateway.domain.model.Capability;
import fr.lapetina.llm.gateway.domain.model.Constraints;
import fr.lapetina.llm.gateway.domain.model.InferenceRequest;
import fr.lapetina.llm.gateway.domain.model.RoutingDecision;
import fr.lapetina.llm.gateway.domain.strategy.RankingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.RoutingContext;
import fr.lapetina.llm.gateway.domain.strategy.RoutingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.StrategyFactory;
import fr.lapetina.llm.gateway.infrastructure.registry.BackendRegistry;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.infrastructure.resilience.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Selects a primary backend and ordered fallbacks for a request.
 *
 * Candidates pass six stages in order: capability, context length, data
 * residency, circuit health, latency, then strategy ranking. The first four
 * fail the request with a stage-specific {@link RoutingException} when they
 * empty the set. The latency stage is soft and is skipped when it would
 * remove every candidate.
 *
 * Routing is deterministic for a fixed registry, circuit state and request.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final BackendRegistry registry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final TokenEstimator tokenEstimator;
    private final Map<RoutingStrategy, RankingStrategy> strategies;
    private final int maxFallbacks;
    private volatile RoutingStrategy defaultStrategy;

    public Router(
            BackendRegistry registry,
            CircuitBreakerRegistry circuitBreakers,
            TokenEstimator tokenEstimator,
            RoutingStrategy defaultStrategy,
            int maxFallbacks
    ) {
        if (maxFallbacks < 0) {
            throw new IllegalArgumentException("maxFallbacks must not be negative");
        }
        this.registry = registry;
        this.circuitBreakers = circuitBreakers;
        this.tokenEstimator = tokenEstimator;
        this.strategies = StrategyFactory.createAll();
        this.defaultStrategy = defaultStrategy;
        this.maxFallbacks = maxFallbacks;
    }

    public Router(BackendRegistry registry, CircuitBreakerRegistry circuitBreakers) {
        this(registry, circuitBreakers, TokenEstimator.characterRatio(), RoutingStrategy.CAPABILITY_FIRST, 2);
    }

    public RoutingDecision route(InferenceRequest request) {
        return route(request, null);
    }

    /**
     * Routes a request.
     *
     * @param strategy ranking strategy, or null for the configured default
     * @throws RoutingException if a hard filter stage leaves no candidate
     */
    public RoutingDecision route(InferenceRequest request, RoutingStrategy strategy) {
        RoutingStrategy effective = strategy != null ? strategy : defaultStrategy;
        int estimatedInput = tokenEstimator.estimateInputTokens(request);
        RoutingContext context = new RoutingContext(request, estimatedInput);
        Constraints constraints = request.constraints();

        List<BackendDescriptor> candidates = filterByCapability(request);
        candidates = filterByContextLength(request, candidates, estimatedInput);
        candidates = filterByResidency(constraints, candidates);
        candidates = filterByHealth(candidates);
        candidates = filterByLatency(constraints, candidates);

        List<BackendDescriptor> ranked = rank(effective, candidates, context);
        BackendDescriptor primary = ranked.get(0);
        List<String> fallbacks = ranked.stream()
                .skip(1)
                .limit(maxFallbacks)
                .map(BackendDescriptor::getId)
                .toList();

        RoutingDecision decision = new RoutingDecision(
                primary.getId(),
                primary.getProvider(),
                fallbacks,
                effective,
                primary.estimateCost(estimatedInput, context.estimatedOutputTokens()),
                primary.getLatency().p50Ms(),
                "Selected " + primary.getDisplayName() + " (" + primary.getId() + ") from "
                        + primary.getProvider() + " using " + effective.getConfigName() + " strategy",
                ranked.size(),
                estimatedInput
        );

        log.info("Request routed: requestId={}, backendId={}, strategy={}, candidates={}, fallbacks={}",
                request.requestId(), primary.getId(), effective.getConfigName(), ranked.size(), fallbacks);
        return decision;
    }

    public int estimateInputTokens(InferenceRequest request) {
        return tokenEstimator.estimateInputTokens(request);
    }

    public RoutingStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public void setDefaultStrategy(RoutingStrategy strategy) {
        RoutingStrategy old = this.defaultStrategy;
        this.defaultStrategy = strategy;
        log.info("Default routing strategy changed: {} -> {}", old.getConfigName(), strategy.getConfigName());
    }

    private List<BackendDescriptor> filterByCapability(InferenceRequest request) {
        Set<Capability> required = request.effectiveCapabilities();
        Set<String> excluded = request.constraints().excludedBackends();
        List<BackendDescriptor> capable = registry.listByCapabilities(required).stream()
                .filter(b -> !excluded.contains(b.getId()))
                .toList();
        if (capable.isEmpty()) {
            throw new RoutingException(ErrorCode.NO_CAPABLE_BACKEND, "capability",
                    "capabilities=" + required + ", excluded=" + excluded);
        }
        return capable;
    }

    private List<BackendDescriptor> filterByContextLength(
            InferenceRequest request,
            List<BackendDescriptor> candidates,
            int estimatedInput
    ) {
        int requiredWindow = estimatedInput + request.requestedMaxTokens();
        int minContext = request.requirements().minContextLength();
        List<BackendDescriptor> fitting = candidates.stream()
                .filter(b -> b.getContextWindow() >= requiredWindow)
                .filter(b -> b.getContextWindow() >= minContext)
                .toList();
        if (fitting.isEmpty()) {
            throw new RoutingException(ErrorCode.CONTEXT_LENGTH_EXCEEDED, "context-length",
                    "requiredTokens=" + requiredWindow + ", minContextLength=" + minContext);
        }
        return fitting;
    }

    private List<BackendDescriptor> filterByResidency(Constraints constraints, List<BackendDescriptor> candidates) {
        Set<String> allowed = constraints.allowedRegions();
        if (allowed.isEmpty()) {
            return candidates;
        }
        List<BackendDescriptor> resident = candidates.stream()
                .filter(b -> b.getRegions().isEmpty() || !Collections.disjoint(b.getRegions(), allowed))
                .toList();
        if (resident.isEmpty()) {
            throw new RoutingException(ErrorCode.DATA_RESIDENCY_VIOLATION, "data-residency",
                    "allowedRegions=" + allowed);
        }
        return resident;
    }

    private List<BackendDescriptor> filterByHealth(List<BackendDescriptor> candidates) {
        // HALF_OPEN stays eligible so trial traffic can close the circuit
        List<BackendDescriptor> healthy = candidates.stream()
                .filter(b -> circuitBreakers.getState(b.getId()) != CircuitBreaker.State.OPEN)
                .toList();
        if (healthy.isEmpty()) {
            throw new RoutingException(ErrorCode.ALL_BACKENDS_UNHEALTHY, "health",
                    "openCircuits=" + candidates.stream().map(BackendDescriptor::getId).toList());
        }
        return healthy;
    }

    private List<BackendDescriptor> filterByLatency(Constraints constraints, List<BackendDescriptor> candidates) {
        Long maxLatency = constraints.maxLatencyMs();
        if (maxLatency == null) {
            return candidates;
        }
        List<BackendDescriptor> fast = candidates.stream()
                .filter(b -> b.getLatency().p99Ms() <= maxLatency)
                .toList();
        if (fast.isEmpty()) {
            log.debug("Latency filter skipped, no backend meets maxLatencyMs={}", maxLatency);
            return candidates;
        }
        return fast;
    }

    /**
     * Applies the strategy, then moves caller-preferred backends to the front
     * and over-budget backends behind in-budget ones. Both moves keep the
     * strategy order within each group.
     */
    private List<BackendDescriptor> rank(
            RoutingStrategy strategy,
            List<BackendDescriptor> candidates,
            RoutingContext context
    ) {
        List<BackendDescriptor> ranked = strategies.get(strategy).rank(candidates, context);
        if (ranked.isEmpty()) {
            throw new RoutingException(ErrorCode.NO_CAPABLE_BACKEND, "ranking",
                    "strategy=" + strategy.getConfigName());
        }

        Constraints constraints = context.request().constraints();
        List<String> preferred = constraints.preferredBackends();
        Double budget = constraints.maxCostUsd();

        Comparator<Integer> order = Comparator
                .comparingInt((Integer i) -> {
                    int index = preferred.indexOf(ranked.get(i).getId());
                    return index >= 0 ? index : Integer.MAX_VALUE;
                })
                .thenComparingInt(i -> budget != null && ranked.get(i).estimateCost(
                        context.estimatedInputTokens(), context.estimatedOutputTokens()) > budget ? 1 : 0)
                .thenComparingInt(i -> i);

        return IntStream.range(0, ranked.size())
                .boxed()
                .sorted(order)
                .map(ranked::get)
                .toList();
    }
}
