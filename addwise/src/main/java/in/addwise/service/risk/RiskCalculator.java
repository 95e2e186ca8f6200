package in.addwise.service.risk;

import in.addwise.config.EngineConfig;
import in.addwise.config.ScoringRules;
import in.addwise.domain.model.Candidate;
import in.addwise.domain.model.RateStats;
import in.addwise.domain.model.RiskAssessment;
import in.addwise.domain.model.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk Calculator - tail-risk assessment for one occupied period.
 *
 * Pipeline:
 *   1. Negative-event rate (HR/9) through the registered adjusters, clamped to [0.5, 3.0]
 *   2. λ = rate/9 × expected duration
 *   3. Disaster probability = P(Poisson(λ) >= threshold)
 *   4. Expected / floor / ceiling value from the scoring rules
 *   5. Blow-up probability = P(value &lt; 0) under a normal approximation
 *   6. Tier + hard filters (NO_GO)
 *
 * NO_GO is reported in the assessment and never thrown. Assessments are
 * recomputed from the candidate on every call.
 */
public final class RiskCalculator {
    private static final Logger log = LoggerFactory.getLogger(RiskCalculator.class);

    public static final double MIN_RATE_PER_9 = 0.5;
    public static final double MAX_RATE_PER_9 = 3.0;

    private static final double RANGE_TO_STDDEV = 3.3;     // floor/ceiling ≈ 10th/90th pct
    private static final double BLOWUP_BASE_VARIANCE = 100.0;
    private static final double MAX_DURATION = 9.0;
    private static final double MIN_FLOOR_DURATION = 2.0;

    private final EngineConfig config;
    private final ScoringRules scoring;
    private final List<RateAdjuster> adjusters;

    public RiskCalculator(EngineConfig config) {
        this(config, RateAdjusters.defaults());
    }

    public RiskCalculator(EngineConfig config, List<RateAdjuster> adjusters) {
        if (config == null || adjusters == null) {
            throw new IllegalArgumentException("config and adjusters are required");
        }
        this.config = config;
        this.scoring = config.scoring();
        this.adjusters = List.copyOf(adjusters);
    }

    /**
     * Replace absent or non-finite stats with league-average defaults and
     * mark the candidate low-confidence. Never excludes.
     */
    public Candidate sanitize(Candidate candidate) {
        RateStats stats = candidate.stats();
        if (stats == null) {
            log.warn("[RISK] {} has no stats, using league averages", candidate.id());
            return candidate.withStats(RateStats.leagueAverage(), true);
        }
        if (!stats.isComplete()) {
            log.warn("[RISK] {} has incomplete stats, filling with league averages", candidate.id());
            return candidate.withStats(stats.fillMissing(), true);
        }
        return candidate;
    }

    /**
     * True when {@link #sanitize} had to substitute anything.
     */
    public static boolean hasMissingData(Candidate candidate) {
        return candidate.stats() == null || !candidate.stats().isComplete();
    }

    /**
     * Full assessment for one occupied period (one start).
     */
    public RiskAssessment assess(Candidate raw) {
        boolean missing = hasMissingData(raw);
        Candidate candidate = sanitize(raw);
        RateStats stats = candidate.stats();
        double duration = stats.durationPerOccurrence();

        double adjustedRate = adjustedNegativeRate(candidate);
        double lambda = adjustedRate / 9.0 * duration;
        double disaster = RiskMath.poissonTail(lambda, config.disasterThreshold());

        ExpectedEvents events = expectedEvents(candidate, lambda);
        double expected = points(duration, events.positive(), events.walks(), events.negative(), events.hits());

        double floor = points(
            Math.max(MIN_FLOOR_DURATION, duration - 2.0),
            Math.max(0.0, events.positive() - 2.0),
            events.walks() + 1.0,
            events.negative() + 1.5,
            events.hits() + 2.0);
        double ceiling = points(
            Math.min(MAX_DURATION, duration + 1.5),
            events.positive() + 3.0,
            Math.max(0.0, events.walks() - 1.0),
            Math.max(0.0, events.negative() - 0.8),
            Math.max(0.0, events.hits() - 2.0));

        double spread = (ceiling - floor) / RANGE_TO_STDDEV;
        double variance = spread * spread;

        // Variance dominated by the Poisson term: Var(pts) ≈ perNegative² · λ + other noise
        double blowupStd = Math.sqrt(scoring.perNegativeEvent() * scoring.perNegativeEvent() * lambda
            + BLOWUP_BASE_VARIANCE);
        double blowup = RiskMath.normalCdf(0.0, expected, blowupStd);

        double riskScore = Math.min(100.0, disaster * 200.0 + blowup * 50.0 + Math.min(15.0, variance / 100.0));
        double riskAdjusted = expected
            - config.riskAversion() * Math.sqrt(variance)
            - disaster * config.catastrophePenalty();

        boolean smallSample = !missing && stats.sampleSize() < config.minSampleSize();
        boolean dangerCombo = candidate.profile().isFlyBall() && candidate.matchup().isDangerCombo();
        boolean hardFiltered = disaster > config.maxDisasterProbability()
            || blowup > config.maxBlowupProbability()
            || smallSample
            || dangerCombo;

        RiskTier tier = hardFiltered ? RiskTier.NO_GO : tierFor(disaster);

        List<String> warnings = warnings(candidate, disaster, tier, missing, smallSample, dangerCombo);
        String recommendation = recommendation(tier, expected, riskAdjusted, disaster);

        log.debug("[RISK] {} rate={} λ={} EV={} disaster={} blowup={} tier={}",
            candidate.id(), String.format("%.2f", adjustedRate), String.format("%.3f", lambda),
            String.format("%.1f", expected), String.format("%.4f", disaster),
            String.format("%.3f", blowup), tier);

        return new RiskAssessment(
            candidate.id(),
            adjustedRate,
            lambda,
            expected,
            floor,
            ceiling,
            variance,
            disaster,
            blowup,
            riskScore,
            riskAdjusted,
            tier,
            hardFiltered,
            candidate.lowConfidence() || missing,
            recommendation,
            warnings
        );
    }

    /**
     * Baseline rate through every adjuster in order, then clamped.
     */
    public double adjustedNegativeRate(Candidate candidate) {
        RateStats stats = candidate.stats() != null ? candidate.stats() : RateStats.leagueAverage();
        double rate = stats.negativePer9();
        for (RateAdjuster adjuster : adjusters) {
            rate = adjuster.adjust(rate, candidate);
        }
        return clampRate(rate);
    }

    /**
     * Disaster probability for an already adjusted rate.
     */
    public static double disasterProbability(double ratePer9, double duration, int threshold) {
        return RiskMath.poissonTail(ratePer9 / 9.0 * duration, threshold);
    }

    public static RiskTier tierFor(double disasterProbability) {
        if (disasterProbability < 0.05) return RiskTier.ELITE;
        if (disasterProbability < 0.10) return RiskTier.SAFE;
        if (disasterProbability < 0.15) return RiskTier.MODERATE;
        if (disasterProbability < 0.25) return RiskTier.RISKY;
        return RiskTier.DANGEROUS;
    }

    static double clampRate(double rate) {
        if (!Double.isFinite(rate)) {
            return MAX_RATE_PER_9;
        }
        return Math.max(MIN_RATE_PER_9, Math.min(MAX_RATE_PER_9, rate));
    }

    private ExpectedEvents expectedEvents(Candidate candidate, double lambda) {
        RateStats stats = candidate.stats();
        double duration = stats.durationPerOccurrence();
        double positiveFactor = candidate.matchup().opponentPositiveFactor();
        if (!(positiveFactor > 0) || !Double.isFinite(positiveFactor)) {
            positiveFactor = 1.0;
        }
        return new ExpectedEvents(
            stats.positivePer9() * positiveFactor / 9.0 * duration,
            stats.walkPer9() / 9.0 * duration,
            lambda,
            stats.hitPer9() / 9.0 * duration
        );
    }

    private double points(double duration, double positive, double walks, double negative, double hits) {
        return scoring.perDurationUnit() * duration
            + scoring.perPositiveEvent() * positive
            + scoring.perWalk() * walks
            + scoring.perNegativeEvent() * negative
            + scoring.perHit() * hits;
    }

    private List<String> warnings(Candidate c, double disaster, RiskTier tier,
                                  boolean missing, boolean smallSample, boolean dangerCombo) {
        List<String> warnings = new ArrayList<>();
        if (tier == RiskTier.NO_GO) {
            warnings.add("HARD FILTER: Do not stream this matchup");
        }
        if (missing) {
            warnings.add("Missing stats: league-average defaults used");
        }
        if (smallSample) {
            warnings.add(String.format("Small sample: %d starts (min %d)",
                c.stats().sampleSize(), config.minSampleSize()));
        }
        if (c.matchup().eliteOpponent()) {
            warnings.add("Elite offense: " + nameOr(c.matchup().opponent(), "opponent"));
        }
        if (c.matchup().venueFactor() >= 1.15) {
            warnings.add(String.format("HR-friendly park: %s (%.0f)",
                nameOr(c.matchup().venue(), "venue"), c.matchup().venueFactor() * 100));
        }
        if (c.profile().isFlyBall()) {
            warnings.add(String.format("Fly ball pitcher (FB%%=%.0f%%) - HR prone", c.profile().flyBallRate() * 100));
        }
        if (dangerCombo) {
            warnings.add("Fly ball pitcher vs elite offense in hitter-friendly park");
        }
        if (c.stats().negativePer9() >= 1.5) {
            warnings.add(String.format("High HR rate: %.2f HR/9", c.stats().negativePer9()));
        }
        if (disaster >= 0.20) {
            warnings.add(String.format("High disaster risk: %.0f%% chance of %d+ HR",
                disaster * 100, config.disasterThreshold()));
        }
        return warnings;
    }

    static String recommendation(RiskTier tier, double expected, double riskAdjusted, double disaster) {
        switch (tier) {
            case NO_GO:
                return "AVOID - Risk too high regardless of upside";
            case ELITE:
                return String.format("STRONG ADD - Safe floor with %.0f pt upside", expected);
            case SAFE:
                return String.format("GOOD ADD - Solid %.0f pt expectation, low risk", expected);
            case MODERATE:
                return riskAdjusted > 20
                    ? String.format("ACCEPTABLE - Worth %.0f risk-adjusted pts", riskAdjusted)
                    : String.format("MARGINAL - Only %.0f risk-adjusted pts", riskAdjusted);
            case RISKY:
                return expected > 35
                    ? String.format("HIGH RISK/REWARD - %.0f pts but %.0f%% disaster", expected, disaster * 100)
                    : String.format("RISKY - Not enough upside (%.0f pts) for %.0f%% disaster risk",
                        expected, disaster * 100);
            case DANGEROUS:
                return String.format("DANGEROUS - %.0f%% disaster probability", disaster * 100);
            default:
                return "EVALUATE FURTHER";
        }
    }

    private static String nameOr(String name, String fallback) {
        return name != null && !name.isBlank() ? name : fallback;
    }

    private record ExpectedEvents(double positive, double walks, double negative, double hits) {}
}
