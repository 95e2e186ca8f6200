package in.addwise.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineConfig} from a JSON file.
 *
 * Never returns null: a missing, unreadable or invalid file yields the
 * defaults. Environment overrides are applied last.
 */
public final class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static EngineConfig load(Path configFile) {
        EngineConfig fromFile = readFile(configFile);
        EngineConfig effective = fromFile.withEnvOverrides();

        if (!effective.isValid()) {
            log.warn("Config after env overrides is invalid, falling back to defaults");
            return EngineConfig.defaults();
        }

        log.info("Engine config: budget={}, reserve={}, horizon={}d, slots/day={}, riskAversion={}, solverCap={}ms",
            effective.weeklyBudget(), effective.reserve(), effective.horizonDays(),
            effective.slotsPerDay(), effective.riskAversion(), effective.solverTimeLimitMs());
        return effective;
    }

    private static EngineConfig readFile(Path configFile) {
        if (configFile == null || !Files.exists(configFile)) {
            log.info("No config file found, using defaults: {}", configFile);
            return EngineConfig.defaults();
        }
        try {
            String json = Files.readString(configFile);
            EngineConfig config = MAPPER.readValue(json, EngineConfig.class);
            if (config.scoring() == null) {
                config = withDefaultScoring(config);
            }
            if (!config.isValid()) {
                log.warn("Invalid config values in {}, using defaults", configFile);
                return EngineConfig.defaults();
            }
            log.info("Loaded engine config from: {}", configFile);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config file, using defaults: {}", e.getMessage());
            return EngineConfig.defaults();
        }
    }

    private static EngineConfig withDefaultScoring(EngineConfig c) {
        return new EngineConfig(c.weeklyBudget(), c.reserve(), c.horizonDays(), c.slotsPerDay(),
            c.riskAversion(), c.catastrophePenalty(), c.disasterThreshold(), c.minSampleSize(),
            c.maxDisasterProbability(), c.maxBlowupProbability(), ScoringRules.defaults(),
            c.banditAlpha(), c.banditRegularization(), c.urgencyWeight(), c.leagueActivity(),
            c.baseThreshold(), c.historyWindow(), c.solverTimeLimitMs(), c.valueScale(), c.backupCount(),
            c.contingencyCount(), c.statePath());
    }

    private EngineConfigLoader() {}
}
