package in.addwise.infrastructure.persistence;

import in.addwise.domain.model.BanditState;
import in.addwise.domain.model.LearnedModel;
import in.addwise.domain.model.PosteriorBelief;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ModelStateStore.
 *
 * Tests:
 * - Save/load of learned state
 * - Fail-soft loading (missing, empty, corrupt, malformed bandit)
 * - Atomic replace leaves no temp files
 */
class ModelStateStoreTest {

    private static final Supplier<BanditState> PRIOR = () -> BanditState.prior(3, 1.0, 1.0, 5, 7);

    @TempDir
    Path dir;

    private static LearnedModel learned() {
        BanditState bandit = new BanditState(3, 1.0, 1.0,
            new double[][] {{2.0, 0.5, 0.0}, {0.5, 1.5, 0.0}, {0.0, 0.0, 1.0}},
            new double[] {12.0, 3.0, 0.0}, 5, 3, 7, 4, 2L);
        Map<String, PosteriorBelief> beliefs = Map.of(
            "cole", PosteriorBelief.prior(20.0, 64.0).withObservation(10.0),
            "webb", PosteriorBelief.prior(18.0, 49.0));
        return new LearnedModel(LearnedModel.CURRENT_VERSION, bandit, beliefs, List.of(25.0, 12.5, 31.0), 1700000000000L);
    }

    @Test
    void testSaveThenLoad() {
        ModelStateStore store = new ModelStateStore(dir.resolve("model.json"));
        LearnedModel original = learned();

        store.save(original);
        LearnedModel loaded = store.load(PRIOR);

        assertEquals(original.posteriors(), loaded.posteriors());
        assertEquals(original.valueHistory(), loaded.valueHistory());
        assertEquals(original.savedAtEpochMs(), loaded.savedAtEpochMs());
        assertArrayEquals(original.bandit().designMatrix()[0], loaded.bandit().designMatrix()[0]);
        assertArrayEquals(original.bandit().rewardVector(), loaded.bandit().rewardVector());
        assertEquals(2L, loaded.bandit().observations());
    }

    @Test
    void testSaveCreatesDirectoriesAndLeavesNoTempFiles() throws IOException {
        Path target = dir.resolve("nested/state/model.json");
        ModelStateStore store = new ModelStateStore(target);

        store.save(learned());
        store.save(learned());

        assertTrue(Files.exists(target));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(List.of(target.getFileName().toString()),
                files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void testMissingFileStartsFromPrior() {
        LearnedModel model = new ModelStateStore(dir.resolve("absent.json")).load(PRIOR);

        assertTrue(model.posteriors().isEmpty());
        assertEquals(0L, model.bandit().observations());
        assertEquals(3, model.bandit().dimension());
    }

    @Test
    void testCorruptOrEmptyFileStartsFromPrior() throws IOException {
        Path corrupt = dir.resolve("corrupt.json");
        Files.writeString(corrupt, "{\"version\": 1, \"bandit\": [oops");
        Path empty = dir.resolve("empty.json");
        Files.write(empty, new byte[0]);

        LearnedModel fromCorrupt = new ModelStateStore(corrupt).load(PRIOR);
        LearnedModel fromEmpty = new ModelStateStore(empty).load(PRIOR);

        assertTrue(fromCorrupt.posteriors().isEmpty());
        assertTrue(fromEmpty.valueHistory().isEmpty());
        assertTrue(fromCorrupt.bandit().isWellFormed());
    }

    @Test
    void testMalformedBanditKeepsBeliefs() throws IOException {
        Path file = dir.resolve("model.json");
        Files.writeString(file, """
            {
              "version": 1,
              "bandit": {"dimension": 3, "designMatrix": [[1.0]], "rewardVector": [0.0]},
              "posteriors": {"cole": {"priorMean": 20.0, "priorVariance": 64.0,
                                      "observedMean": 10.0, "observationVariance": 100.0, "count": 1}},
              "valueHistory": [14.0]
            }
            """);

        LearnedModel model = new ModelStateStore(file).load(PRIOR);

        assertTrue(model.bandit().isWellFormed());
        assertEquals(0L, model.bandit().observations());
        assertEquals(16.1, model.posteriors().get("cole").posteriorMean(), 0.01);
        assertEquals(List.of(14.0), model.valueHistory());
    }

    @Test
    void testUnknownFieldsIgnored() throws IOException {
        ModelStateStore store = new ModelStateStore(dir.resolve("model.json"));
        store.save(learned());
        String json = Files.readString(store.path());
        Files.writeString(store.path(), json.replaceFirst("\\{", "{\"addedNextSeason\": {\"x\": 1},"));

        LearnedModel model = store.load(PRIOR);

        assertEquals(2, model.posteriors().size());
    }
}
