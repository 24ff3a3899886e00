package ebulter.hanabi.store.config;

import java.nio.file.Path;

/**
 * Locations the store reads from and writes to, taken from environment variables
 */
public class StoreSettings {
    public static final String DATA_DIR_ENV = "HANABI_DATA_DIR";
    public static final String CHALLENGE_CONFIG_ENV = "HANABI_CHALLENGE_CONFIG";
    public static final String DEFAULT_DATA_DIR = "hanabi-data";

    private final Path dataDirectory;
    private final Path challengeConfigFile; // null: use the bundled classpath resource

    public StoreSettings(Path dataDirectory, Path challengeConfigFile) {
        this.dataDirectory = dataDirectory;
        this.challengeConfigFile = challengeConfigFile;
    }

    public static StoreSettings fromEnvironment() {
        String dataDir = System.getenv(DATA_DIR_ENV);
        String configFile = System.getenv(CHALLENGE_CONFIG_ENV);
        return new StoreSettings(
                Path.of(isBlank(dataDir) ? DEFAULT_DATA_DIR : dataDir),
                isBlank(configFile) ? null : Path.of(configFile));
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path getChallengeConfigFile() {
        return challengeConfigFile;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
