package fr.lapetina.llm.gateway.domain.exception;

import java.util.List;

/**
 * Raised when a routing stage empties the candidate set, or when every
 * routed candidate failed during execution.
 *
 * The stage name and the violated constraint are kept for diagnostics.
 */
public final class RoutingException extends GatewayException {

    private final String stage;
    private final String constraint;
    private final List<String> attemptedBackends;

    public RoutingException(ErrorCode code, String stage, String constraint) {
        this(code, stage, constraint, List.of(), null);
    }

    public RoutingException(
            ErrorCode code,
            String stage,
            String constraint,
            List<String> attemptedBackends,
            Throwable lastFailure
    ) {
        super(code, "stage=" + stage + ", constraint=" + constraint
                + (attemptedBackends.isEmpty() ? "" : ", attempted=" + attemptedBackends), lastFailure);
        if (code.getCategory() != ErrorCategory.ROUTING) {
            throw new IllegalArgumentException("Not a routing error code: " + code);
        }
        this.stage = stage;
        this.constraint = constraint;
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    public String getStage() {
        return stage;
    }

    public String getConstraint() {
        return constraint;
    }

    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }
}
