package ebulter.hanabi.store.config;

import ebulter.hanabi.store.model.ChallengeRequest;
import ebulter.hanabi.store.model.ConstraintType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ChallengeConfigLoaderTest {

    private final ChallengeConfigLoader loader = new ChallengeConfigLoader();

    @Nested
    class ResourceTests {
        @Test
        public void load_WithoutFile_ShouldUseBundledResource() {
            ChallengeConfig config = loader.load(null);

            assertNotNull(config);
            assertEquals(5, config.getPredefinedRequests().size());
            assertEquals("req-sunset", config.getPredefinedRequests().get(0).getId());
            assertTrue(config.getPredefinedRequests().stream().noneMatch(ChallengeRequest::isCompleted));
            assertEquals(3, config.getMaxActiveRequests());
        }

        @Test
        public void loadFromResource_ShouldReadRequestsConstraintsAndClampLimits() {
            ChallengeConfig config = loader.loadFromResource("test-challenge-config.json");

            assertNotNull(config);
            assertEquals(2, config.getPredefinedRequests().size());

            ChallengeRequest moon = config.getPredefinedRequests().get(1);
            assertEquals("r2", moon.getId());
            assertEquals("Draw a moon", moon.getPrompt());
            assertTrue(moon.isCompleted());
            assertEquals(ConstraintType.TIME_LIMIT, moon.getConstraints().get(0).getType());
            assertEquals(45f, moon.getConstraints().get(0).getFloatValue());

            assertEquals(10, config.getMaxActiveRequests());
            assertEquals(5f, config.getDefaultTimeLimit());
            assertEquals(1, config.getDefaultColorLimit());
        }

        @Test
        public void loadFromResource_Missing_ShouldReturnNull() {
            assertNull(loader.loadFromResource("does-not-exist.json"));
        }
    }

    @Nested
    class FileTests {
        @TempDir
        Path tempDir;

        @Test
        public void load_WithFile_ShouldPreferFileOverResource() throws IOException {
            Path file = tempDir.resolve("challenges.json");
            Files.writeString(file, "{\"predefinedRequests\":[{\"id\":\"x\",\"prompt\":\"Draw a fish\"}]}");

            ChallengeConfig config = loader.load(file);

            assertNotNull(config);
            assertEquals(1, config.getPredefinedRequests().size());
            assertEquals("Draw a fish", config.getPredefinedRequests().get(0).getPrompt());
            assertFalse(config.getPredefinedRequests().get(0).isCompleted());
            assertEquals(60f, config.getDefaultTimeLimit());
        }

        @Test
        public void load_MissingFile_ShouldReturnNull() {
            assertNull(loader.load(tempDir.resolve("missing.json")));
        }

        @Test
        public void loadFromFile_MalformedJson_ShouldReturnNull() throws IOException {
            Path file = tempDir.resolve("broken.json");
            Files.writeString(file, "{\"predefinedRequests\": [");

            assertNull(loader.loadFromFile(file));
        }
    }

    @Nested
    class ParseTests {
        @Test
        public void parse_UnknownProperties_ShouldBeIgnored() {
            ChallengeConfig config = loader.parse("{\"maxActiveRequests\":5,\"theme\":\"dark\"}");

            assertNotNull(config);
            assertEquals(5, config.getMaxActiveRequests());
            assertNull(config.getPredefinedRequests());
        }

        @Test
        public void parse_NullOrBlank_ShouldReturnNull() {
            assertNull(loader.parse(null));
            assertNull(loader.parse("   "));
        }

        @Test
        public void parse_MalformedJson_ShouldReturnNull() {
            assertNull(loader.parse("not json"));
        }
    }
}
