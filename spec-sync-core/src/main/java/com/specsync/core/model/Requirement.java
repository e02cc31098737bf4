package com.specsync.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluated requirement for one component.
 *
 * <p>There is at most one requirement per component and name. Requirements are never
 * edited in place: a sync clears and recreates them.
 *
 * @param name requirement name, unique within the component
 * @param artifactType category of artifact the requirement is about
 * @param description human readable description
 * @param checker checker that produced the result
 * @param score score in [0.0, 1.0]
 * @param satisfied whether the score met the definition's threshold
 * @param details checker specific details, such as a reason or a path
 * @param checkedAt when the check ran
 * @param componentId owning component id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Requirement(
    @JsonProperty("name") String name,
    @JsonProperty("artifactType") ArtifactType artifactType,
    @JsonProperty("description") String description,
    @JsonProperty("checker") CheckerKind checker,
    @JsonProperty("score") double score,
    @JsonProperty("satisfied") boolean satisfied,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("checkedAt") Instant checkedAt,
    @JsonProperty("componentId") String componentId
) {

    public Requirement {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(artifactType, "artifactType must not be null");
        Objects.requireNonNull(checker, "checker must not be null");
        Objects.requireNonNull(componentId, "componentId must not be null");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0.0, 1.0]: " + score);
        }
        if (description == null) {
            description = "";
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * Returns whether the requirement was produced by a relational checker.
     *
     * @return true for dependency and hierarchical requirements
     */
    @JsonIgnore
    public boolean isRelational() {
        return checker.isRelational();
    }
}
