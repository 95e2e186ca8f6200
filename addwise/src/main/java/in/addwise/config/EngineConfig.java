package in.addwise.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.addwise.util.Env;

/**
 * Engine configuration.
 *
 * Loaded from JSON by {@link EngineConfigLoader}; any field can then be
 * overridden through the environment (see {@link #withEnvOverrides()}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    // Budget / horizon
    @JsonProperty("weeklyBudget")
    int weeklyBudget,               // adds per horizon

    @JsonProperty("reserve")
    int reserve,                    // adds held back for emergencies

    @JsonProperty("horizonDays")
    int horizonDays,

    @JsonProperty("slotsPerDay")
    int slotsPerDay,                // default renewable capacity

    // Risk
    @JsonProperty("riskAversion")
    double riskAversion,            // stddev penalty weight

    @JsonProperty("catastrophePenalty")
    double catastrophePenalty,      // extra points lost per unit disaster probability

    @JsonProperty("disasterThreshold")
    int disasterThreshold,          // negative events that make a disaster

    @JsonProperty("minSampleSize")
    int minSampleSize,              // below this track record -> NO_GO

    @JsonProperty("maxDisasterProbability")
    double maxDisasterProbability,

    @JsonProperty("maxBlowupProbability")
    double maxBlowupProbability,

    @JsonProperty("scoring")
    ScoringRules scoring,

    // Bandit
    @JsonProperty("banditAlpha")
    double banditAlpha,

    @JsonProperty("banditRegularization")
    double banditRegularization,

    @JsonProperty("urgencyWeight")
    double urgencyWeight,           // points of bonus for an option expiring tomorrow

    // Snipe / threshold
    @JsonProperty("leagueActivity")
    double leagueActivity,          // multiplier on hazard intensities

    @JsonProperty("baseThreshold")
    double baseThreshold,           // acceptance threshold with no history

    @JsonProperty("historyWindow")
    int historyWindow,              // realised values kept for percentiles, 0 = unbounded

    // Optimizer
    @JsonProperty("solverTimeLimitMs")
    long solverTimeLimitMs,

    @JsonProperty("valueScale")
    int valueScale,                 // objective integer scaling (x10 = 0.1 pt precision)

    @JsonProperty("backupCount")
    int backupCount,

    @JsonProperty("contingencyCount")
    int contingencyCount,

    // Persistence
    @JsonProperty("statePath")
    String statePath
) {
    public static EngineConfig defaults() {
        return new EngineConfig(
            5,          // 5 adds per week
            0,
            7,          // Mon-Sun
            2,
            1.0,
            30.0,
            3,          // 3+ HR is a blowup start
            3,
            0.30,
            0.50,
            ScoringRules.defaults(),
            1.0,
            1.0,
            5.0,
            1.0,
            40.0,
            500,        // about two seasons of adds
            1000L,      // 1s cap, solves are ~ms at this scale
            10,
            5,
            5,
            "state/learned-model.json"
        );
    }

    public boolean isValid() {
        return weeklyBudget >= 0
            && reserve >= 0 && reserve <= weeklyBudget
            && horizonDays > 0
            && slotsPerDay >= 0
            && riskAversion >= 0
            && catastrophePenalty >= 0
            && disasterThreshold >= 1
            && minSampleSize >= 0
            && maxDisasterProbability > 0 && maxDisasterProbability <= 1
            && maxBlowupProbability > 0 && maxBlowupProbability <= 1
            && scoring != null && scoring.isValid()
            && banditAlpha >= 0
            && banditRegularization > 0
            && urgencyWeight >= 0
            && leagueActivity > 0
            && historyWindow >= 0
            && solverTimeLimitMs > 0
            && valueScale >= 1
            && backupCount >= 0
            && contingencyCount >= 0;
    }

    /**
     * Apply ADDWISE_* environment / system property overrides.
     */
    public EngineConfig withEnvOverrides() {
        return new EngineConfig(
            Env.getInt("ADDWISE_BUDGET", weeklyBudget),
            Env.getInt("ADDWISE_RESERVE", reserve),
            Env.getInt("ADDWISE_HORIZON_DAYS", horizonDays),
            Env.getInt("ADDWISE_SLOTS_PER_DAY", slotsPerDay),
            Env.getDouble("ADDWISE_RISK_AVERSION", riskAversion),
            Env.getDouble("ADDWISE_CATASTROPHE_PENALTY", catastrophePenalty),
            disasterThreshold,
            Env.getInt("ADDWISE_MIN_SAMPLE_SIZE", minSampleSize),
            maxDisasterProbability,
            maxBlowupProbability,
            scoring,
            Env.getDouble("ADDWISE_BANDIT_ALPHA", banditAlpha),
            banditRegularization,
            urgencyWeight,
            Env.getDouble("ADDWISE_LEAGUE_ACTIVITY", leagueActivity),
            baseThreshold,
            Env.getInt("ADDWISE_HISTORY_WINDOW", historyWindow),
            Env.getLong("ADDWISE_SOLVER_TIME_LIMIT_MS", solverTimeLimitMs),
            valueScale,
            backupCount,
            contingencyCount,
            Env.get("ADDWISE_STATE_PATH", statePath)
        );
    }
}
