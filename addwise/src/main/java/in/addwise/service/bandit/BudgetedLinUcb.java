package in.addwise.service.bandit;

import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.UcbScore;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Budgeted LinUCB - one linear reward model shared across all arms.
 *
 * UCB(x) = x·θ + α·√(xᵀA⁻¹x)·min(2, budgetRatio/timeRatio) + urgency
 *
 * where θ = A⁻¹b. Exploration shrinks when the budget runs ahead of the
 * clock and collapses to 0.1× once no time remains. A and b survive
 * horizon resets; only the budget/time counters are restored.
 */
public final class BudgetedLinUcb {
    private static final Logger log = LoggerFactory.getLogger(BudgetedLinUcb.class);

    private static final double MAX_EXPLORATION_SCALE = 2.0;
    private static final double END_OF_HORIZON_SCALE = 0.1;

    private final int dimension;
    private final double alpha;
    private final double regularization;
    private final double urgencyWeight;

    private final DMatrixRMaj a;   // d x d
    private final DMatrixRMaj b;   // d x 1

    private int totalBudget;
    private int budgetRemaining;
    private int horizonDays;
    private int timeRemaining;
    private long observations;

    public BudgetedLinUcb(int dimension, double alpha, double regularization,
                          int budget, int horizonDays, double urgencyWeight) {
        this(BanditState.prior(dimension, alpha, regularization, budget, horizonDays), urgencyWeight);
    }

    private BudgetedLinUcb(BanditState state, double urgencyWeight) {
        if (!state.isWellFormed()) {
            throw new IllegalArgumentException("Malformed bandit state (dimension " + state.dimension() + ")");
        }
        this.dimension = state.dimension();
        this.alpha = state.alpha();
        this.regularization = state.regularization();
        this.urgencyWeight = urgencyWeight;
        this.a = new DMatrixRMaj(state.designMatrix());
        this.b = new DMatrixRMaj(dimension, 1);
        for (int i = 0; i < dimension; i++) {
            b.set(i, 0, state.rewardVector()[i]);
        }
        this.totalBudget = state.totalBudget();
        this.budgetRemaining = state.budgetRemaining();
        this.horizonDays = state.horizonDays();
        this.timeRemaining = state.timeRemaining();
        this.observations = state.observations();
    }

    public static BudgetedLinUcb fromState(BanditState state, double urgencyWeight) {
        return new BudgetedLinUcb(state, urgencyWeight);
    }

    /**
     * Score one context.
     *
     * @param deadlineDays days until the option expires, null when unknown
     */
    public UcbScore score(double[] context, Integer deadlineDays) {
        DMatrixRMaj x = column(context);
        DMatrixRMaj aInv = inverse();

        DMatrixRMaj theta = new DMatrixRMaj(dimension, 1);
        CommonOps_DDRM.mult(aInv, b, theta);
        double mean = VectorVectorMult_DDRM.innerProd(x, theta);

        DMatrixRMaj aInvX = new DMatrixRMaj(dimension, 1);
        CommonOps_DDRM.mult(aInv, x, aInvX);
        double quadratic = Math.max(0.0, VectorVectorMult_DDRM.innerProd(x, aInvX));
        double confidence = alpha * Math.sqrt(quadratic);

        double bonus = confidence * explorationScale();

        double urgency = 0.0;
        if (deadlineDays != null && deadlineDays > 0) {
            urgency = urgencyWeight / deadlineDays;
        }
        return new UcbScore(mean, bonus, urgency);
    }

    /**
     * min(2, budgetRatio / timeRatio); 0.1 once the horizon has run out.
     */
    public double explorationScale() {
        double budgetRatio = (double) budgetRemaining / Math.max(totalBudget, 1);
        double timeRatio = (double) timeRemaining / Math.max(horizonDays, 1);
        if (timeRatio <= 0) {
            return END_OF_HORIZON_SCALE;
        }
        return Math.min(budgetRatio / timeRatio, MAX_EXPLORATION_SCALE);
    }

    /**
     * Arm with the highest total score. Ties go to the smaller id.
     *
     * @return empty when the budget is exhausted or there are no arms
     */
    public Optional<Selection> select(Map<String, double[]> contexts, Map<String, Integer> deadlines) {
        if (budgetRemaining <= 0 || contexts == null || contexts.isEmpty()) {
            return Optional.empty();
        }
        Selection best = null;
        for (Map.Entry<String, double[]> e : new TreeMap<>(contexts).entrySet()) {
            Integer deadline = deadlines != null ? deadlines.get(e.getKey()) : null;
            UcbScore score = score(e.getValue(), deadline);
            if (best == null || score.total() > best.score().total()) {
                best = new Selection(e.getKey(), score);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Fold an observed reward in and consume one budget unit.
     */
    public void update(double[] context, double reward) {
        observe(context, reward);
        consume();
    }

    /**
     * A += xxᵀ, b += r·x without touching the budget. The unit is
     * consumed separately, once per pick, however many days it scores.
     */
    public void observe(double[] context, double reward) {
        checkDimension(context);
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                a.add(i, j, context[i] * context[j]);
            }
            b.add(i, 0, reward * context[i]);
        }
        observations++;
        log.debug("[BANDIT] Observe reward={} n={}", String.format("%.1f", reward), observations);
    }

    /**
     * One unit spent, whatever the pick's reward turns out to be.
     */
    public void consume() {
        budgetRemaining = Math.max(0, budgetRemaining - 1);
        log.debug("[BANDIT] Budget {}/{}", budgetRemaining, totalBudget);
    }

    public void advanceTime() {
        timeRemaining = Math.max(0, timeRemaining - 1);
    }

    /**
     * New horizon: counters back to full, learned A and b untouched.
     */
    public void resetHorizon(int budget, int days) {
        if (budget < 0 || days <= 0) {
            throw new IllegalArgumentException("Invalid horizon: budget=" + budget + ", days=" + days);
        }
        this.totalBudget = budget;
        this.budgetRemaining = budget;
        this.horizonDays = days;
        this.timeRemaining = days;
        log.info("[BANDIT] Horizon reset: budget={}, days={}, observations so far={}", budget, days, observations);
    }

    public BanditState toState() {
        double[][] matrix = new double[dimension][dimension];
        double[] vector = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            for (int j = 0; j < dimension; j++) {
                matrix[i][j] = a.get(i, j);
            }
            vector[i] = b.get(i, 0);
        }
        return new BanditState(dimension, alpha, regularization, matrix, vector,
            totalBudget, budgetRemaining, horizonDays, timeRemaining, observations);
    }

    public int dimension() { return dimension; }
    public int budgetRemaining() { return budgetRemaining; }
    public int timeRemaining() { return timeRemaining; }
    public long observations() { return observations; }

    private DMatrixRMaj inverse() {
        DMatrixRMaj aInv = new DMatrixRMaj(dimension, dimension);
        if (!CommonOps_DDRM.invert(a, aInv)) {
            // A = λI + Σxxᵀ is positive definite for λ > 0, so this means corrupt state
            throw new IllegalStateException("Bandit design matrix is singular");
        }
        return aInv;
    }

    private DMatrixRMaj column(double[] context) {
        checkDimension(context);
        DMatrixRMaj x = new DMatrixRMaj(dimension, 1);
        for (int i = 0; i < dimension; i++) {
            x.set(i, 0, context[i]);
        }
        return x;
    }

    private void checkDimension(double[] context) {
        if (context == null || context.length != dimension) {
            throw new IllegalArgumentException("Context must have " + dimension + " features, got "
                + (context == null ? "null" : context.length));
        }
    }

    public record Selection(String armId, UcbScore score) {}
}
