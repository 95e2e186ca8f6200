package in.addwise.bootstrap;

import in.addwise.application.port.output.AvailabilityOracle;
import in.addwise.application.port.output.CandidateFeed;
import in.addwise.config.EngineConfig;
import in.addwise.config.EngineConfigLoader;
import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.LearnedModel;
import in.addwise.infrastructure.persistence.ModelStateStore;
import in.addwise.service.bandit.ContextFeatures;
import in.addwise.service.horizon.RollingHorizonManager;
import in.addwise.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Wires the engine: config → learned state → manager.
 *
 * The caller supplies the feed and the availability oracle; everything
 * else is built here. Call {@link Engine#persist()} after each day to
 * write the learned state back.
 */
public final class EngineBootstrap {
    private static final Logger log = LoggerFactory.getLogger(EngineBootstrap.class);

    public static final String CONFIG_PATH_KEY = "ADDWISE_CONFIG";
    public static final String DEFAULT_CONFIG_PATH = "config/addwise.json";

    public static Engine start(CandidateFeed feed, AvailabilityOracle oracle) {
        return start(Path.of(Env.get(CONFIG_PATH_KEY, DEFAULT_CONFIG_PATH)), feed, oracle);
    }

    public static Engine start(Path configFile, CandidateFeed feed, AvailabilityOracle oracle) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Starting add/stream engine");
        log.info("════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfigLoader.load(configFile);
        return start(config, feed, oracle);
    }

    public static Engine start(EngineConfig config, CandidateFeed feed, AvailabilityOracle oracle) {
        if (!config.isValid()) {
            throw new IllegalStateException("Invalid engine config: " + config);
        }
        ModelStateStore store = new ModelStateStore(Path.of(config.statePath()));
        LearnedModel model = store.load(() -> priorBandit(config));

        RollingHorizonManager manager = new RollingHorizonManager(config, model, feed, oracle);
        log.info("Engine started: state file {}", store.path());
        return new Engine(config, manager, store);
    }

    static BanditState priorBandit(EngineConfig config) {
        return BanditState.prior(ContextFeatures.DIMENSION, config.banditAlpha(),
            config.banditRegularization(), config.weeklyBudget(), config.horizonDays());
    }

    /**
     * Running engine: the manager plus the store its learned state goes to.
     */
    public static final class Engine {
        private final EngineConfig config;
        private final RollingHorizonManager manager;
        private final ModelStateStore store;

        Engine(EngineConfig config, RollingHorizonManager manager, ModelStateStore store) {
            this.config = config;
            this.manager = manager;
            this.store = store;
        }

        public RollingHorizonManager manager() {
            return manager;
        }

        public EngineConfig config() {
            return config;
        }

        /**
         * Snapshot the learned state and write it atomically.
         */
        public LearnedModel persist() {
            LearnedModel model = manager.exportModel();
            store.save(model);
            return model;
        }
    }

    private EngineBootstrap() {}
}
