package in.addwise.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normal-Normal belief about one recurring identity's per-period value.
 *
 * Precisions add: 1/σ²_post = 1/σ²_prior + n/σ²_obs, so the posterior
 * variance never grows with more observations.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PosteriorBelief(
    @JsonProperty("priorMean")
    double priorMean,

    @JsonProperty("priorVariance")
    double priorVariance,

    @JsonProperty("observedMean")
    double observedMean,

    @JsonProperty("observationVariance")
    double observationVariance,   // game-to-game noise

    @JsonProperty("count")
    int count
) {
    public static final double DEFAULT_OBSERVATION_VARIANCE = 100.0;

    public PosteriorBelief {
        if (!(priorVariance > 0) || !(observationVariance > 0)) {
            throw new IllegalArgumentException(
                "Variances must be positive: prior=" + priorVariance + ", observation=" + observationVariance);
        }
        if (count < 0) {
            throw new IllegalArgumentException("Observation count must be non-negative: " + count);
        }
    }

    public static PosteriorBelief prior(double mean, double variance) {
        return new PosteriorBelief(mean, variance, 0.0, DEFAULT_OBSERVATION_VARIANCE, 0);
    }

    public static PosteriorBelief prior(double mean, double variance, double observationVariance) {
        return new PosteriorBelief(mean, variance, 0.0, observationVariance, 0);
    }

    public double posteriorMean() {
        if (count == 0) {
            return priorMean;
        }
        double priorPrecision = 1.0 / priorVariance;
        double obsPrecision = count / observationVariance;
        return (priorPrecision * priorMean + obsPrecision * observedMean) / (priorPrecision + obsPrecision);
    }

    public double posteriorVariance() {
        if (count == 0) {
            return priorVariance;
        }
        return 1.0 / (1.0 / priorVariance + count / observationVariance);
    }

    public double posteriorStdDev() {
        return Math.sqrt(posteriorVariance());
    }

    /**
     * Same observations against a different prior mean.
     */
    public PosteriorBelief withPriorMean(double mean) {
        return new PosteriorBelief(mean, priorVariance, observedMean, observationVariance, count);
    }

    /**
     * New belief with one more observation folded into the running mean.
     */
    public PosteriorBelief withObservation(double observed) {
        int n = count + 1;
        double mean = observedMean + (observed - observedMean) / n;
        return new PosteriorBelief(priorMean, priorVariance, mean, observationVariance, n);
    }
}
