package ebulter.hanabi.store.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A Challenge Mode drawing request: a prompt plus the constraints the drawing must satisfy.
 * Completion is one-way and produces a new instance.
 */
public class ChallengeRequest {
    @JsonProperty("id")
    private String id;

    @JsonProperty("prompt")
    private String prompt;

    @JsonProperty("constraints")
    private List<Constraint> constraints;

    @JsonProperty("isCompleted")
    @SerializedName("isCompleted")
    private boolean completed;

    private ChallengeRequest() {
    }

    public ChallengeRequest(String id, String prompt, List<Constraint> constraints) {
        this(id, prompt, constraints, false);
    }

    public ChallengeRequest(String id, String prompt, List<Constraint> constraints, boolean completed) {
        this.id = id;
        this.prompt = prompt;
        this.constraints = constraints == null ? new ArrayList<>() : new ArrayList<>(constraints);
        this.completed = completed;
    }

    public String getId() {
        return id;
    }

    public String getPrompt() {
        return prompt;
    }

    public List<Constraint> getConstraints() {
        return constraints == null ? List.of() : Collections.unmodifiableList(constraints);
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Returns a copy marked as completed, all other fields preserved
     */
    public ChallengeRequest withCompleted() {
        return new ChallengeRequest(id, prompt, constraints, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ChallengeRequest that = (ChallengeRequest) o;
        return completed == that.completed
                && Objects.equals(id, that.id)
                && Objects.equals(prompt, that.prompt)
                && getConstraints().equals(that.getConstraints());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, prompt, getConstraints(), completed);
    }

    @Override
    public String toString() {
        return "ChallengeRequest{id='" + id + "', prompt='" + prompt + "', completed=" + completed + "}";
    }
}
