package in.addwise.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.LearnedModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * JSON file store for the {@link LearnedModel}.
 *
 * Loading is fail-soft: a missing, empty or corrupt file yields a fresh
 * prior and a WARN, never an exception. Saving writes a temp file next to
 * the target and moves it into place atomically, so a crash mid-write
 * leaves the previous snapshot intact.
 */
public final class ModelStateStore {
    private static final Logger log = LoggerFactory.getLogger(ModelStateStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public ModelStateStore(Path path) {
        this(path, new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ModelStateStore(Path path, ObjectMapper mapper) {
        if (path == null) {
            throw new IllegalArgumentException("State path is required");
        }
        this.path = path;
        this.mapper = mapper;
    }

    /**
     * @param prior bandit prior used when nothing usable is on disk
     */
    public LearnedModel load(Supplier<BanditState> prior) {
        if (!Files.exists(path)) {
            log.info("[STATE] No learned state at {}, starting from prior", path);
            return LearnedModel.fresh(prior.get());
        }
        try {
            byte[] raw = Files.readAllBytes(path);
            if (raw.length == 0) {
                log.warn("[STATE] Learned state file {} is empty, starting from prior", path);
                return LearnedModel.fresh(prior.get());
            }
            LearnedModel model = mapper.readValue(raw, LearnedModel.class);
            if (model == null) {
                log.warn("[STATE] Learned state file {} holds no model, starting from prior", path);
                return LearnedModel.fresh(prior.get());
            }
            if (model.bandit() == null || !model.bandit().isWellFormed()) {
                log.warn("[STATE] Bandit state in {} is malformed, keeping beliefs but resetting bandit", path);
                model = new LearnedModel(model.version(), prior.get(), model.posteriors(),
                    model.valueHistory(), model.savedAtEpochMs());
            }
            if (model.version() > LearnedModel.CURRENT_VERSION) {
                log.warn("[STATE] Learned state version {} is newer than {}, unknown fields ignored",
                    model.version(), LearnedModel.CURRENT_VERSION);
            }
            log.info("[STATE] Loaded learned state from {}: {} beliefs, {} bandit observations",
                path, model.posteriors().size(), model.bandit().observations());
            return model;
        } catch (IOException | RuntimeException e) {
            log.warn("[STATE] Learned state at {} is unreadable ({}), starting from prior", path, e.toString());
            return LearnedModel.fresh(prior.get());
        }
    }

    /**
     * Atomic write: temp file in the same directory, then rename over the target.
     *
     * @throws UncheckedIOException if the snapshot cannot be written
     */
    public void save(LearnedModel model) {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), model);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("[STATE] Atomic move unsupported on this filesystem, using plain replace");
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("[STATE] Saved learned state to {} ({} beliefs)", target, model.posteriors().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to save learned state to " + target, e);
        }
    }

    public Path path() {
        return path;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[STATE] Could not remove temp file {}: {}", tmp, e.toString());
        }
    }
}
