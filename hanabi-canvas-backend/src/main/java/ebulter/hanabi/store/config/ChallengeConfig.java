package ebulter.hanabi.store.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import ebulter.hanabi.store.model.ChallengeRequest;

import java.util.List;

/**
 * JSON structure for the Challenge Mode configuration: the predefined requests loaded
 * at startup plus the default limits. Limits are clamped when read.
 * The store only uses the predefined requests; the limits are exposed for the challenge mode screens.
 */
public class ChallengeConfig {
    static final int MIN_MAX_ACTIVE_REQUESTS = 1;
    static final int MAX_MAX_ACTIVE_REQUESTS = 10;
    static final float MIN_TIME_LIMIT = 5f;
    static final int MIN_COLOR_LIMIT = 1;

    @JsonProperty("predefinedRequests")
    private List<ChallengeRequest> predefinedRequests;

    @JsonProperty("maxActiveRequests")
    private int maxActiveRequests = 3;

    @JsonProperty("defaultTimeLimit")
    private float defaultTimeLimit = 60f;

    @JsonProperty("defaultColorLimit")
    private int defaultColorLimit = 4;

    public ChallengeConfig() {}

    public ChallengeConfig(List<ChallengeRequest> predefinedRequests) {
        this.predefinedRequests = predefinedRequests;
    }

    // Getters and setters
    public List<ChallengeRequest> getPredefinedRequests() { return predefinedRequests; }
    public void setPredefinedRequests(List<ChallengeRequest> predefinedRequests) {
        this.predefinedRequests = predefinedRequests;
    }

    public int getMaxActiveRequests() {
        return Math.max(MIN_MAX_ACTIVE_REQUESTS, Math.min(MAX_MAX_ACTIVE_REQUESTS, maxActiveRequests));
    }
    public void setMaxActiveRequests(int maxActiveRequests) { this.maxActiveRequests = maxActiveRequests; }

    public float getDefaultTimeLimit() { return Math.max(MIN_TIME_LIMIT, defaultTimeLimit); }
    public void setDefaultTimeLimit(float defaultTimeLimit) { this.defaultTimeLimit = defaultTimeLimit; }

    public int getDefaultColorLimit() { return Math.max(MIN_COLOR_LIMIT, defaultColorLimit); }
    public void setDefaultColorLimit(int defaultColorLimit) { this.defaultColorLimit = defaultColorLimit; }
}
