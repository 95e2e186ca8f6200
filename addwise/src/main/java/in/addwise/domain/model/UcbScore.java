package in.addwise.domain.model;

/**
 * Bandit score for one context vector.
 *
 * total = pointEstimate + explorationBonus + urgencyBonus
 */
public record UcbScore(double pointEstimate, double explorationBonus, double urgencyBonus) {

    public static UcbScore none() {
        return new UcbScore(0.0, 0.0, 0.0);
    }

    public double total() {
        return pointEstimate + explorationBonus + urgencyBonus;
    }
}
