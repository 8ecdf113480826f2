package fr.lapetina.llm.gateway.domain.model;

/**
 * Cost in USD per million units (tokens).
 */
public record CostProfile(double inputPerMillion, double outputPerMillion, double cachedPerMillion) {

    public static final CostProfile FREE = new CostProfile(0, 0, 0);

    public CostProfile {
        if (inputPerMillion < 0 || outputPerMillion < 0 || cachedPerMillion < 0) {
            throw new IllegalArgumentException("Costs must not be negative");
        }
    }

    public double estimate(int inputUnits, int outputUnits) {
        return (inputUnits * inputPerMillion + outputUnits * outputPerMillion) / 1_000_000.0;
    }
}
