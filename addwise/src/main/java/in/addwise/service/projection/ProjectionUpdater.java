package in.addwise.service.projection;

import in.addwise.domain.model.PosteriorBelief;
import in.addwise.service.risk.RiskMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Bayesian projection updater (Normal-Normal conjugate).
 *
 * One belief per recurring identity. A prior is set once; later
 * observations shrink the posterior toward the observed mean.
 */
public final class ProjectionUpdater {
    private static final Logger log = LoggerFactory.getLogger(ProjectionUpdater.class);

    private final Map<String, PosteriorBelief> beliefs;

    public ProjectionUpdater() {
        this(Map.of());
    }

    public ProjectionUpdater(Map<String, PosteriorBelief> learned) {
        this.beliefs = new LinkedHashMap<>(learned);
    }

    /**
     * Register a prior. Ignored when the identity already has a belief.
     *
     * @return true if the prior was registered
     */
    public boolean initializeWithPrior(String id, double priorMean, double priorVariance) {
        return initializeWithPrior(id, priorMean, priorVariance, PosteriorBelief.DEFAULT_OBSERVATION_VARIANCE);
    }

    public boolean initializeWithPrior(String id, double priorMean, double priorVariance, double observationVariance) {
        if (beliefs.containsKey(id)) {
            log.debug("[PROJECTION] Prior already set for {}, keeping existing belief", id);
            return false;
        }
        beliefs.put(id, PosteriorBelief.prior(priorMean, priorVariance, observationVariance));
        return true;
    }

    /**
     * Fold one observed outcome into the identity's belief.
     *
     * @return the new belief, or empty when no prior was registered
     */
    public Optional<PosteriorBelief> update(String id, double observed) {
        PosteriorBelief current = beliefs.get(id);
        if (current == null) {
            log.debug("[PROJECTION] No prior for {}, observation {} ignored", id, observed);
            return Optional.empty();
        }
        if (!Double.isFinite(observed)) {
            log.warn("[PROJECTION] Non-finite observation for {} ignored", id);
            return Optional.of(current);
        }
        PosteriorBelief next = current.withObservation(observed);
        beliefs.put(id, next);
        log.debug("[PROJECTION] {} n={} mean {} -> {}, var {} -> {}", id, next.count(),
            String.format("%.2f", current.posteriorMean()), String.format("%.2f", next.posteriorMean()),
            String.format("%.2f", current.posteriorVariance()), String.format("%.2f", next.posteriorVariance()));
        return Optional.of(next);
    }

    public Optional<PosteriorBelief> belief(String id) {
        return Optional.ofNullable(beliefs.get(id));
    }

    public boolean hasBelief(String id) {
        return beliefs.containsKey(id);
    }

    public double posteriorMean(String id) {
        return require(id).posteriorMean();
    }

    /**
     * Posterior mean with the prior re-centred on {@code priorMean}.
     * Observations and variances are kept; with none it is {@code priorMean}.
     */
    public double posteriorMean(String id, double priorMean) {
        return require(id).withPriorMean(priorMean).posteriorMean();
    }

    public double posteriorVariance(String id) {
        return require(id).posteriorVariance();
    }

    /**
     * Draw from N(posterior mean, posterior variance). Used for Thompson-style exploration.
     */
    public double sample(String id, Random random) {
        PosteriorBelief belief = require(id);
        return belief.posteriorMean() + random.nextGaussian() * belief.posteriorStdDev();
    }

    /**
     * Central interval holding {@code level} of the posterior mass.
     */
    public Interval confidenceInterval(String id, double level) {
        if (!(level > 0 && level < 1)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + level);
        }
        PosteriorBelief belief = require(id);
        double z = RiskMath.normalQuantile((1 + level) / 2);
        double half = z * belief.posteriorStdDev();
        return new Interval(belief.posteriorMean() - half, belief.posteriorMean() + half);
    }

    /**
     * Read-only view for persistence.
     */
    public Map<String, PosteriorBelief> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(beliefs));
    }

    private PosteriorBelief require(String id) {
        PosteriorBelief belief = beliefs.get(id);
        if (belief == null) {
            throw new IllegalArgumentException("No belief registered for " + id);
        }
        return belief;
    }

    public record Interval(double lower, double upper) {
        public double width() {
            return upper - lower;
        }

        public boolean contains(double value) {
            return value >= lower && value <= upper;
        }
    }
}
