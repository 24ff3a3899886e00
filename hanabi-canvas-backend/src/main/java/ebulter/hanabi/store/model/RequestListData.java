package ebulter.hanabi.store.model;

import java.util.List;

/**
 * JSON structure for exported challenge requests, wrapped the same way as {@link ArtworkListData}
 */
public class RequestListData {
    private List<ChallengeRequest> requests;

    public RequestListData() {}

    public RequestListData(List<ChallengeRequest> requests) {
        this.requests = requests;
    }

    public List<ChallengeRequest> getRequests() { return requests; }
    public void setRequests(List<ChallengeRequest> requests) { this.requests = requests; }
}
