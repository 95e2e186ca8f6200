package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Serializable parameters of the shared LinUCB model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BanditState(
    @JsonProperty("dimension")
    int dimension,

    @JsonProperty("alpha")
    double alpha,                 // exploration coefficient

    @JsonProperty("regularization")
    double regularization,

    @JsonProperty("designMatrix")
    double[][] designMatrix,      // A, d x d

    @JsonProperty("rewardVector")
    double[] rewardVector,        // b, d

    @JsonProperty("totalBudget")
    int totalBudget,

    @JsonProperty("budgetRemaining")
    int budgetRemaining,

    @JsonProperty("horizonDays")
    int horizonDays,

    @JsonProperty("timeRemaining")
    int timeRemaining,

    @JsonProperty("observations")
    long observations
) {
    /**
     * Prior state: A = λI, b = 0, counters full.
     */
    public static BanditState prior(int dimension, double alpha, double regularization, int budget, int horizonDays) {
        double[][] a = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            a[i][i] = regularization;
        }
        return new BanditState(dimension, alpha, regularization, a, new double[dimension],
            budget, budget, horizonDays, horizonDays, 0L);
    }

    /**
     * Shape check used when loading persisted state.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (dimension <= 0 || designMatrix == null || rewardVector == null) {
            return false;
        }
        if (designMatrix.length != dimension || rewardVector.length != dimension) {
            return false;
        }
        for (double[] row : designMatrix) {
            if (row == null || row.length != dimension) {
                return false;
            }
        }
        return budgetRemaining >= 0 && timeRemaining >= 0;
    }
}
