package in.addwise.service.horizon;

import in.addwise.application.port.output.AvailabilityOracle;
import in.addwise.application.port.output.BudgetConfig;
import in.addwise.application.port.output.CandidateFeed;
import in.addwise.application.port.output.CapacityConfig;
import in.addwise.config.EngineConfig;
import in.addwise.domain.model.ActNowDecision;
import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.Candidate;
import in.addwise.domain.model.CommittedPick;
import in.addwise.domain.model.Contingency;
import in.addwise.domain.model.DailyCapacity;
import in.addwise.domain.model.DailyRecommendation;
import in.addwise.domain.model.EngineWarning;
import in.addwise.domain.model.LearnedModel;
import in.addwise.domain.model.OptimizationResult;
import in.addwise.domain.model.PosteriorBelief;
import in.addwise.domain.model.RiskAssessment;
import in.addwise.domain.model.RiskTier;
import in.addwise.domain.model.ScoredCandidate;
import in.addwise.domain.model.UcbScore;
import in.addwise.domain.model.UrgencyEntry;
import in.addwise.domain.model.WarningType;
import in.addwise.domain.model.WeeklyBudget;
import in.addwise.service.bandit.BudgetedLinUcb;
import in.addwise.service.bandit.ContextFeatures;
import in.addwise.service.optimizer.BranchAndBoundSolver;
import in.addwise.service.optimizer.ContingencyPlanner;
import in.addwise.service.optimizer.SlotOptimizer;
import in.addwise.service.optimizer.SlotSolver;
import in.addwise.service.projection.ProjectionUpdater;
import in.addwise.service.risk.RiskAdaptiveUtility;
import in.addwise.service.risk.RiskCalculator;
import in.addwise.service.snipe.ActNowPolicy;
import in.addwise.service.snipe.SurvivalModel;
import in.addwise.service.snipe.ThresholdCalculator;
import in.addwise.service.snipe.UrgencyScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolling-Horizon Manager.
 *
 * Owns the day-by-day loop over one horizon:
 *   score (risk + posterior + bandit) → optimize → recommend → confirm → record → advance
 *
 * Committed picks are fixed: their budget unit is spent and their capacity
 * is subtracted before every re-solve. The horizon state is an immutable
 * snapshot replaced on each call; learned state (bandit, posteriors,
 * value history) survives horizon resets and is handed back through
 * {@link #exportModel()}.
 *
 * Single-threaded. Not safe for concurrent use.
 */
public final class RollingHorizonManager {
    private static final Logger log = LoggerFactory.getLogger(RollingHorizonManager.class);

    private final EngineConfig config;
    private final CandidateFeed feed;
    private final AvailabilityOracle oracle;

    private final RiskCalculator risk;
    private final ProjectionUpdater projections;
    private final BudgetedLinUcb bandit;
    private final SurvivalModel survival;
    private final ActNowPolicy actNowPolicy;
    private final UrgencyScorer urgencyScorer;
    private final SlotOptimizer optimizer;
    private final ContingencyPlanner contingencyPlanner;

    private ThresholdCalculator thresholds;
    private RiskAdaptiveUtility riskUtility = RiskAdaptiveUtility.neutral();
    private HorizonState state;

    // Context vectors of committed picks, kept for the bandit update on outcome
    private final Map<String, double[]> pickContexts = new HashMap<>();
    private final Map<String, ScoredCandidate> lastScored = new LinkedHashMap<>();
    private final List<EngineWarning> pendingWarnings = new ArrayList<>();

    public RollingHorizonManager(EngineConfig config, LearnedModel model,
                                 CandidateFeed feed, AvailabilityOracle oracle) {
        this(config, model, feed, oracle, new RiskCalculator(config),
            new BranchAndBoundSolver(Duration.ofMillis(config.solverTimeLimitMs())));
    }

    public RollingHorizonManager(EngineConfig config, LearnedModel model,
                                 CandidateFeed feed, AvailabilityOracle oracle,
                                 RiskCalculator risk, SlotSolver solver) {
        if (config == null || feed == null || oracle == null) {
            throw new IllegalArgumentException("config, feed and oracle are required");
        }
        this.config = config;
        this.feed = feed;
        this.oracle = oracle;
        this.risk = risk;

        LearnedModel learned = model != null ? model : LearnedModel.fresh(priorBandit(config));
        this.projections = new ProjectionUpdater(learned.posteriors());
        this.bandit = BudgetedLinUcb.fromState(restoreBandit(learned.bandit()), config.urgencyWeight());
        this.thresholds = new ThresholdCalculator(learned.valueHistory(), config.baseThreshold(), config.horizonDays(),
            config.historyWindow());

        this.survival = new SurvivalModel(config.leagueActivity());
        this.actNowPolicy = new ActNowPolicy(survival);
        this.urgencyScorer = new UrgencyScorer(survival);
        this.optimizer = new SlotOptimizer(config, solver);
        this.contingencyPlanner = new ContingencyPlanner(optimizer, config.contingencyCount());

        this.state = HorizonState.initial(BudgetConfig.from(config).toBudget(), CapacityConfig.from(config));
        log.info("[HORIZON] Engine ready: {} beliefs, {} bandit observations, {} historical values",
            learned.posteriors().size(), bandit.observations(), learned.valueHistory().size());
    }

    // ═══════════════════════════════════════════════════════════════
    // Horizon lifecycle
    // ═══════════════════════════════════════════════════════════════

    public HorizonState startHorizon() {
        return startHorizon(BudgetConfig.from(config), CapacityConfig.from(config));
    }

    /**
     * New horizon. Unused budget from the previous one is forfeited; learned
     * state carries over.
     */
    public HorizonState startHorizon(BudgetConfig budgetConfig, CapacityConfig capacityConfig) {
        if (state != null && state.budget().remaining() > 0 && (state.day() > 0 || !state.committed().isEmpty())) {
            log.info("[HORIZON] Forfeiting {} unused units from previous horizon", state.budget().remaining());
        }
        WeeklyBudget budget = budgetConfig.toBudget();
        state = HorizonState.initial(budget, capacityConfig);
        bandit.resetHorizon(budget.total(), budget.horizonDays());
        thresholds = new ThresholdCalculator(thresholds.history(), config.baseThreshold(), budget.horizonDays(),
            config.historyWindow());
        pickContexts.clear();
        lastScored.clear();
        pendingWarnings.clear();
        log.info("[HORIZON] Started: budget={} (reserve {}), {} days", budget.total(), budget.reserve(), budget.horizonDays());
        return state;
    }

    public HorizonState advanceDay() {
        requireOpen();
        HorizonState next = state.advance();
        bandit.advanceTime();
        int finished = next.history().size() - state.history().size();
        state = next;
        lastScored.clear();
        if (state.complete()) {
            log.info("[HORIZON] Horizon complete: {} picks, {} units unused", state.history().size()
                + state.committed().size(), state.budget().remaining());
        } else {
            log.info("[HORIZON] Day {}: {} picks finished, budget {}/{}", state.day(), finished,
                state.budget().remaining(), state.budget().total());
        }
        return state;
    }

    /**
     * Replace the per-day slot ceilings mid-horizon. Existing commitments
     * are kept; {@link #reoptimize()} fails if they no longer fit.
     */
    public HorizonState updateCapacity(CapacityConfig capacityConfig) {
        if (capacityConfig.horizonDays() != state.horizonDays()) {
            throw new IllegalArgumentException("Capacity horizon " + capacityConfig.horizonDays()
                + " != " + state.horizonDays());
        }
        state = state.withCapacity(capacityConfig);
        return state;
    }

    /**
     * Change total or reserve mid-horizon, keeping units already spent.
     */
    public HorizonState updateBudget(BudgetConfig budgetConfig) {
        int used = state.budget().used();
        if (budgetConfig.total() < used) {
            throw new InfeasibleConstraintException(state.day(),
                "Budget " + budgetConfig.total() + " is below the " + used + " units already committed");
        }
        WeeklyBudget updated = new WeeklyBudget(budgetConfig.total(), budgetConfig.reserve(),
            budgetConfig.total() - used, state.horizonDays());
        state = state.withBudget(updated);
        return state;
    }

    /**
     * Matchup state used for the risk-adaptive utility term.
     */
    public void updateMatchupState(double myScore, double opponentScore) {
        int daysRemaining = Math.max(0, state.horizonDays() - state.day());
        riskUtility = RiskAdaptiveUtility.of(myScore, opponentScore, daysRemaining);
        log.debug("[HORIZON] Score differential {} with {} days left: θ={}",
            riskUtility.scoreDifferential(), daysRemaining, riskUtility.theta());
    }

    // ═══════════════════════════════════════════════════════════════
    // Scoring
    // ═══════════════════════════════════════════════════════════════

    /**
     * Per-day value for the optimizer:
     *   risk-adjusted value (posterior mean in place of EV once learned)
     *   - 0.5·θ·σ  (matchup-state utility)
     *   + bandit exploration bonus
     *
     * The prior is re-centred on today's assessment on every call, so a
     * changed opponent or venue moves the value even after the belief
     * was first registered.
     */
    public ScoredCandidate score(Candidate candidate) {
        RiskAssessment assessment = risk.assess(candidate);

        double priorMean = candidate.priorOutcome() != null && Double.isFinite(candidate.priorOutcome())
            ? candidate.priorOutcome()
            : assessment.expectedValue();
        projections.initializeWithPrior(candidate.id(), priorMean, Math.max(1.0, assessment.variance()));

        double riskPenalty = assessment.expectedValue() - assessment.riskAdjustedValue();
        double projected = projections.posteriorMean(candidate.id(), priorMean);
        double perDay = riskUtility.adjust(projected - riskPenalty, assessment.stdDev());

        double[] context = ContextFeatures.of(candidate, assessment);
        int deadline = Math.max(1, candidate.firstDay() - state.day());
        UcbScore ucb = bandit.score(context, deadline);
        perDay += ucb.explorationBonus();

        return new ScoredCandidate(candidate, perDay, assessment.riskTier(), assessment, ucb);
    }

    /**
     * Bandit's single best arm among today's open candidates.
     */
    public Optional<BudgetedLinUcb.Selection> banditChoice() {
        ScoringPass pass = scorePool();
        Map<String, double[]> contexts = new LinkedHashMap<>();
        Map<String, Integer> deadlines = new LinkedHashMap<>();
        for (ScoredCandidate sc : pass.scored()) {
            if (!sc.isSelectable()) continue;
            contexts.put(sc.id(), ContextFeatures.of(sc.candidate(), sc.assessment()));
            deadlines.put(sc.id(), Math.max(1, sc.candidate().firstDay() - state.day()));
        }
        return bandit.select(contexts, deadlines);
    }

    // ═══════════════════════════════════════════════════════════════
    // Planning
    // ═══════════════════════════════════════════════════════════════

    /**
     * Re-solve the rest of the horizon around the existing commitments.
     *
     * @throws InfeasibleConstraintException if commitments overrun a day's capacity
     */
    public OptimizationResult reoptimize() {
        requireOpen();
        checkCommitmentsFit();
        ScoringPass pass = scorePool();
        return optimizer.optimize(pass.scored(), state.budget().usable(), state.freeCapacity(), state.day());
    }

    /**
     * Today's plan, must-act subset, urgency ranking, contingencies and
     * warnings. Must-act picks are confirmed with the availability oracle;
     * a claimed one is excluded and the plan re-solved.
     */
    public DailyRecommendation recommendToday() {
        requireOpen();
        checkCommitmentsFit();
        int today = state.day();

        ScoringPass pass = scorePool();
        List<EngineWarning> warnings = new ArrayList<>(pendingWarnings);
        pendingWarnings.clear();
        warnings.addAll(pass.warnings());

        List<ScoredCandidate> pool = new ArrayList<>(pass.scored());
        int usable = state.budget().usable();
        int[] capacity = state.freeCapacity();
        int remaining = state.budget().remaining();
        double threshold = thresholds.threshold(today, remaining);
        double optionValue = thresholds.optionValue(today, remaining);

        OptimizationResult plan;
        List<ActNowDecision> mustAct;
        List<ActNowDecision> deferred;
        while (true) {
            plan = optimizer.optimize(pool, usable, capacity, today);
            mustAct = new ArrayList<>();
            deferred = new ArrayList<>();
            for (ScoredCandidate sc : plan.selected()) {
                ActNowDecision decision = actNowPolicy.decide(sc, today, plan.commitDays().get(sc.id()),
                    optionValue, threshold);
                (decision.actNow() ? mustAct : deferred).add(decision);
            }

            String stale = mustAct.stream()
                .map(ActNowDecision::candidateId)
                .filter(id -> !oracle.isAvailable(id))
                .findFirst()
                .orElse(null);
            if (stale == null) {
                break;
            }
            log.warn("[HORIZON] {} was claimed before it could be added, re-solving without it", stale);
            warnings.add(new EngineWarning(WarningType.STALE_AVAILABILITY, stale,
                "Claimed by another manager; excluded and plan re-solved"));
            state = state.withUnavailable(stale);
            pool.removeIf(sc -> sc.id().equals(stale));
            lastScored.remove(stale);
        }

        if (!plan.optimal()) {
            warnings.add(new EngineWarning(WarningType.SOLVER_TIMEOUT, null,
                "Solver hit its time limit; plan is the best feasible found"));
        }

        List<UrgencyEntry> urgency = urgencyScorer.rank(
            pool.stream().filter(ScoredCandidate::isSelectable).toList(), today);
        Map<String, Contingency> contingencies = contingencyPlanner.plan(plan, pool, usable, capacity, today);

        DailyRecommendation recommendation = new DailyRecommendation(today, plan, mustAct, deferred, urgency,
            contingencies, threshold, optionValue, warnings);
        log.info("[HORIZON] Day {} recommendation: act now {}, deferred {}, threshold {}, option value {}",
            today, recommendation.mustActIds(), deferred.size(),
            String.format("%.1f", threshold), String.format("%.1f", optionValue));
        return recommendation;
    }

    // ═══════════════════════════════════════════════════════════════
    // Commit / learn
    // ═══════════════════════════════════════════════════════════════

    /**
     * Commit a pick: one budget unit spent, capacity reserved on every
     * remaining occupied day. A NO_GO candidate can be committed as a
     * deliberate override; it is flagged and warned about.
     */
    public HorizonState confirmPick(String candidateId) {
        requireOpen();
        if (state.isPicked(candidateId)) {
            throw new IllegalStateException("Candidate " + candidateId + " is already committed");
        }
        ScoredCandidate sc = lastScored.get(candidateId);
        if (sc == null) {
            sc = scorePool().scored().stream()
                .filter(s -> s.id().equals(candidateId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown or expired candidate: " + candidateId));
        }

        if (state.budget().isExhausted()) {
            throw new InfeasibleConstraintException(state.day(),
                "No budget left to commit " + candidateId);
        }
        List<DailyCapacity> days = state.dailyCapacities();
        for (int d : sc.candidate().occupiedDays()) {
            if (d >= days.size()) {
                throw new IllegalArgumentException(candidateId + " occupies day " + d + " outside the horizon");
            }
            if (days.get(d).available() <= 0) {
                throw new InfeasibleConstraintException(state.day(),
                    "Day " + d + " has no free slot for " + candidateId);
            }
        }

        boolean override = sc.riskTier() == RiskTier.NO_GO;
        if (override) {
            log.warn("[HORIZON] NO_GO override: committing {} despite hard filter", candidateId);
            pendingWarnings.add(new EngineWarning(WarningType.NO_GO_OVERRIDE, candidateId,
                "Committed despite NO_GO assessment"));
        }

        CommittedPick pick = new CommittedPick(candidateId, state.day(), sc.candidate().occupiedDays(),
            true, sc.perDayValue(), override);
        state = state.withCommitted(pick, state.budget().consume());
        bandit.consume();
        if (sc.assessment() != null) {
            pickContexts.put(candidateId, ContextFeatures.of(sc.candidate(), sc.assessment()));
        }
        lastScored.remove(candidateId);

        log.info("[HORIZON] Committed {} on day {} for days {}, budget {}/{}", candidateId, state.day(),
            pick.occupiedDays(), state.budget().remaining(), state.budget().total());
        return state;
    }

    /**
     * Learn from one realised occupied-day value: bandit reward, posterior
     * observation and threshold history. The bandit's budget unit was
     * spent at commit, so a multi-day pick's later days only add evidence.
     * An id not committed this horizon still updates its posterior but
     * stays out of the bandit and the threshold history, which hold
     * realised pickup values only.
     */
    public void recordOutcome(String candidateId, double realizedValue) {
        if (!Double.isFinite(realizedValue)) {
            throw new IllegalArgumentException("Realised value must be finite: " + realizedValue);
        }
        double[] context = pickContexts.get(candidateId);
        if (context != null) {
            bandit.observe(context, realizedValue);
            thresholds.addObservation(realizedValue);
        } else {
            log.warn("[HORIZON] {} was not committed this horizon, bandit and threshold history not updated",
                candidateId);
        }
        projections.update(candidateId, realizedValue);
        log.info("[HORIZON] Outcome {} = {} pts", candidateId, String.format("%.1f", realizedValue));
    }

    public LearnedModel exportModel() {
        return new LearnedModel(LearnedModel.CURRENT_VERSION, bandit.toState(), projections.snapshot(),
            thresholds.history(), 0L).stamped(System.currentTimeMillis());
    }

    public HorizonState state() {
        return state;
    }

    public Optional<PosteriorBelief> belief(String candidateId) {
        return projections.belief(candidateId);
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private ScoringPass scorePool() {
        int today = state.day();
        List<ScoredCandidate> scored = new ArrayList<>();
        List<EngineWarning> warnings = new ArrayList<>();
        lastScored.clear();

        List<Candidate> fetched = feed.fetchCandidates(today);
        for (Candidate raw : fetched == null ? List.<Candidate>of() : fetched) {
            if (state.isPicked(raw.id()) || state.unavailable().contains(raw.id())) {
                continue;
            }
            Candidate open = raw.remainingFrom(today);
            if (open == null) {
                log.debug("[HORIZON] {} expired (last day {})", raw.id(), raw.lastDay());
                continue;
            }
            ScoredCandidate sc = score(open);
            if (RiskCalculator.hasMissingData(open)) {
                warnings.add(new EngineWarning(WarningType.MISSING_DATA, open.id(),
                    "Stats missing; league-average defaults used"));
            }
            if (sc.riskTier() == RiskTier.NO_GO) {
                warnings.add(new EngineWarning(WarningType.HARD_FILTERED, open.id(),
                    sc.assessment().recommendation()));
            }
            scored.add(sc);
            lastScored.put(sc.id(), sc);
        }
        return new ScoringPass(scored, warnings);
    }

    private void checkCommitmentsFit() {
        for (DailyCapacity dc : state.dailyCapacities()) {
            if (dc.day() >= state.day() && dc.isOverrun()) {
                throw new InfeasibleConstraintException(state.day(), String.format(
                    "Day %d has %d committed picks but only %d slots", dc.day(), dc.consumed(), dc.slots()));
            }
        }
    }

    private void requireOpen() {
        if (state.complete()) {
            throw new IllegalStateException("Horizon is complete; call startHorizon()");
        }
    }

    private BanditState restoreBandit(BanditState persisted) {
        if (persisted != null && persisted.isWellFormed() && persisted.dimension() == ContextFeatures.DIMENSION) {
            return persisted;
        }
        if (persisted != null) {
            log.warn("[HORIZON] Persisted bandit state unusable (dimension {}), starting from prior",
                persisted.dimension());
        }
        return priorBandit(config);
    }

    private static BanditState priorBandit(EngineConfig config) {
        return BanditState.prior(ContextFeatures.DIMENSION, config.banditAlpha(), config.banditRegularization(),
            config.weeklyBudget(), config.horizonDays());
    }

    private record ScoringPass(List<ScoredCandidate> scored, List<EngineWarning> warnings) {}
}
