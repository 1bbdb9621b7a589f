package com.boundplan.planning.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable convergence state of one planning session. Every instance owns its collections.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class SessionState {

    private final String sessionId;
    private final Set<String> knownFields;
    private final Map<String, Object> knownContext;
    private final Set<String> grantedPermissions;
    @Nullable
    private Map<String, Object> userPreferences;
    @Nullable
    private Map<String, Object> timeline;
    @Nullable
    private Map<String, Object> escalation;
    @Nullable
    private BoundPlanSpec lastBoundPlanSpec;
    @Nullable
    private NextInputRequest lastNextInputRequest;
    private long revision;

    public SessionState(String sessionId) {
        this(sessionId, null, null, null, null, null, null, null, null, 0L);
    }

    @JsonCreator
    public SessionState(@JsonProperty("session_id") String sessionId,
                        @JsonProperty("known_fields") @Nullable Collection<String> knownFields,
                        @JsonProperty("known_context") @Nullable Map<String, Object> knownContext,
                        @JsonProperty("user_preferences") @Nullable Map<String, Object> userPreferences,
                        @JsonProperty("granted_permissions") @Nullable Collection<String> grantedPermissions,
                        @JsonProperty("timeline") @Nullable Map<String, Object> timeline,
                        @JsonProperty("escalation") @Nullable Map<String, Object> escalation,
                        @JsonProperty("last_bound_plan_spec") @Nullable BoundPlanSpec lastBoundPlanSpec,
                        @JsonProperty("last_next_input_request") @Nullable NextInputRequest lastNextInputRequest,
                        @JsonProperty("revision") long revision) {
        this.sessionId = sessionId;
        this.knownFields = knownFields != null ? new LinkedHashSet<>(knownFields) : new LinkedHashSet<>();
        this.knownContext = knownContext != null ? new LinkedHashMap<>(knownContext) : new LinkedHashMap<>();
        this.grantedPermissions = grantedPermissions != null
                ? new LinkedHashSet<>(grantedPermissions)
                : new LinkedHashSet<>();
        this.userPreferences = userPreferences;
        this.timeline = timeline;
        this.escalation = escalation;
        this.lastBoundPlanSpec = lastBoundPlanSpec;
        this.lastNextInputRequest = lastNextInputRequest;
        this.revision = revision;
    }

    /**
     * Records a field as known and stores its value in the known context.
     */
    public void remember(String field, Object value) {
        knownFields.add(field);
        knownContext.put(field, value);
    }

    public void rememberAll(Map<String, ?> values) {
        values.forEach(this::remember);
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("known_fields")
    public Set<String> getKnownFields() {
        return knownFields;
    }

    @JsonProperty("known_context")
    public Map<String, Object> getKnownContext() {
        return knownContext;
    }

    @JsonProperty("user_preferences")
    @Nullable
    public Map<String, Object> getUserPreferences() {
        return userPreferences;
    }

    public void setUserPreferences(@Nullable Map<String, Object> userPreferences) {
        this.userPreferences = userPreferences;
    }

    @JsonProperty("granted_permissions")
    public Set<String> getGrantedPermissions() {
        return grantedPermissions;
    }

    @JsonProperty("timeline")
    @Nullable
    public Map<String, Object> getTimeline() {
        return timeline;
    }

    public void setTimeline(@Nullable Map<String, Object> timeline) {
        this.timeline = timeline;
    }

    @JsonProperty("escalation")
    @Nullable
    public Map<String, Object> getEscalation() {
        return escalation;
    }

    public void setEscalation(@Nullable Map<String, Object> escalation) {
        this.escalation = escalation;
    }

    @JsonProperty("last_bound_plan_spec")
    @Nullable
    public BoundPlanSpec getLastBoundPlanSpec() {
        return lastBoundPlanSpec;
    }

    public void setLastBoundPlanSpec(@Nullable BoundPlanSpec lastBoundPlanSpec) {
        this.lastBoundPlanSpec = lastBoundPlanSpec;
    }

    @JsonProperty("last_next_input_request")
    @Nullable
    public NextInputRequest getLastNextInputRequest() {
        return lastNextInputRequest;
    }

    public void setLastNextInputRequest(@Nullable NextInputRequest lastNextInputRequest) {
        this.lastNextInputRequest = lastNextInputRequest;
    }

    @JsonProperty("revision")
    public long getRevision() {
        return revision;
    }

    public void setRevision(long revision) {
        this.revision = revision;
    }
}
