package ebulter.hanabi.store.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the {@link ChallengeConfig} from a file or a classpath resource.
 * A missing or unreadable config yields null, which the store treats as "no predefined requests".
 */
public class ChallengeConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ChallengeConfigLoader.class);
    public static final String DEFAULT_RESOURCE = "challenge-config.json";

    private final ObjectMapper objectMapper;

    public ChallengeConfigLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ChallengeConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads from the given file if set, otherwise from the default classpath resource
     */
    public ChallengeConfig load(Path configFile) {
        if (configFile != null) {
            return loadFromFile(configFile);
        }
        return loadFromResource(DEFAULT_RESOURCE);
    }

    public ChallengeConfig loadFromFile(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            logger.warn("Challenge config {} not found, no predefined requests will be loaded", configFile);
            return null;
        }

        try {
            ChallengeConfig config = objectMapper.readValue(configFile.toFile(), ChallengeConfig.class);
            logLoaded(config, configFile.toString());
            return config;
        } catch (IOException e) {
            logger.warn("Failed to read challenge config {}: {}", configFile, e.getMessage());
            return null;
        }
    }

    public ChallengeConfig loadFromResource(String resourceName) {
        try (InputStream in = ChallengeConfigLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                logger.info("No challenge config resource {} on the classpath", resourceName);
                return null;
            }
            ChallengeConfig config = objectMapper.readValue(in, ChallengeConfig.class);
            logLoaded(config, resourceName);
            return config;
        } catch (IOException e) {
            logger.warn("Failed to read challenge config resource {}: {}", resourceName, e.getMessage());
            return null;
        }
    }

    /**
     * Parses a config from a JSON string. Returns null for missing, blank or malformed JSON.
     */
    public ChallengeConfig parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(json, ChallengeConfig.class);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse challenge config: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static void logLoaded(ChallengeConfig config, String source) {
        int requestCount = config != null && config.getPredefinedRequests() != null
                ? config.getPredefinedRequests().size() : 0;
        logger.info("Loaded challenge config from {} with {} predefined requests", source, requestCount);
    }
}
