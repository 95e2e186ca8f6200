package in.addwise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EngineConfigLoader.
 *
 * Tests:
 * - Defaults for missing, unreadable and invalid files
 * - Values read from JSON
 * - Environment / system property overrides
 */
class EngineConfigLoaderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("ADDWISE_BUDGET");
        System.clearProperty("ADDWISE_RISK_AVERSION");
        System.clearProperty("ADDWISE_HISTORY_WINDOW");
    }

    private Path writeConfig(String field, Object value) throws IOException {
        ObjectNode node = MAPPER.valueToTree(EngineConfig.defaults());
        node.putPOJO(field, value);
        Path file = dir.resolve("addwise.json");
        Files.writeString(file, MAPPER.writeValueAsString(node));
        return file;
    }

    @Test
    void testMissingFileGivesDefaults() {
        assertEquals(EngineConfig.defaults(), EngineConfigLoader.load(dir.resolve("nope.json")));
    }

    @Test
    void testReadsValuesFromFile() throws IOException {
        Path file = writeConfig("weeklyBudget", 6);

        EngineConfig config = EngineConfigLoader.load(file);

        assertEquals(6, config.weeklyBudget());
        assertEquals(EngineConfig.defaults().scoring(), config.scoring());
    }

    @Test
    void testMissingScoringBlockUsesDefaultScoring() throws IOException {
        ObjectNode node = MAPPER.valueToTree(EngineConfig.defaults());
        node.remove("scoring");
        Path file = dir.resolve("addwise.json");
        Files.writeString(file, MAPPER.writeValueAsString(node));

        assertEquals(ScoringRules.defaults(), EngineConfigLoader.load(file).scoring());
    }

    @Test
    void testInvalidValuesGiveDefaults() throws IOException {
        Path file = writeConfig("reserve", 9);   // reserve above budget

        assertEquals(EngineConfig.defaults(), EngineConfigLoader.load(file));
    }

    @Test
    void testUnparseableFileGivesDefaults() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "weeklyBudget = 5");

        assertEquals(EngineConfig.defaults(), EngineConfigLoader.load(file));
    }

    @Test
    void testSystemPropertyOverrides() {
        System.setProperty("ADDWISE_BUDGET", "4");
        System.setProperty("ADDWISE_RISK_AVERSION", "not-a-number");

        EngineConfig config = EngineConfigLoader.load(dir.resolve("nope.json"));

        assertEquals(4, config.weeklyBudget());
        assertEquals(1.0, config.riskAversion(), "Unparseable override is ignored");
    }

    @Test
    void testHistoryWindow() throws IOException {
        assertEquals(500, EngineConfig.defaults().historyWindow());
        assertEquals(EngineConfig.defaults(), EngineConfigLoader.load(writeConfig("historyWindow", -1)));

        System.setProperty("ADDWISE_HISTORY_WINDOW", "50");
        assertEquals(50, EngineConfigLoader.load(dir.resolve("nope.json")).historyWindow());
    }

    @Test
    void testDefaultsAreValid() {
        assertTrue(EngineConfig.defaults().isValid());
        assertTrue(ScoringRules.defaults().isValid());
    }
}
