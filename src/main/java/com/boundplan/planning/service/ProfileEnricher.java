package com.boundplan.planning.service;

import static com.boundplan.planning.PlanningConstants.FIELD_PROFILE;

import com.boundplan.planning.api.ProfileDirectory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks a person up in the profile directory and flattens the views it finds into known
 * fields. Each view is fetched independently; a missing or failing view only narrows the
 * result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileEnricher {

    public static final String EMR_DATA = "emr_data";
    public static final String SYSTEM_DATA = "system_data";
    public static final String HEALTH_PLAN_DATA = "health_plan_data";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ProfileDirectory profileDirectory;
    private final ObjectMapper objectMapper;

    /**
     * @return flattened profile fields plus the raw record under {@code patient_profile},
     *         or null when no profile matched or the lookup failed.
     */
    @Nullable
    public Map<String, Object> fetch(String identifier) {
        if (!StringUtils.hasText(identifier)) {
            return null;
        }
        try {
            List<String> matches;
            try {
                matches = profileDirectory.search(identifier.trim());
            } catch (Exception ex) {
                log.warn("Profile search failed: {}", ex.getMessage());
                return null;
            }
            if (matches.isEmpty()) {
                log.debug("No profile matched the given identifier.");
                return null;
            }
            String profileId = matches.get(0);

            Map<String, Object> record = new LinkedHashMap<>();
            record.put("patient_id", profileId);
            fetchView(profileId, ProfileDirectory.View.CLINICAL).ifPresent(v -> record.put(EMR_DATA, v));
            fetchView(profileId, ProfileDirectory.View.SYSTEM).ifPresent(v -> record.put(SYSTEM_DATA, v));
            fetchView(profileId, ProfileDirectory.View.HEALTH_PLAN).ifPresent(v -> record.put(HEALTH_PLAN_DATA, v));

            Map<String, Object> fields = flatten(profileId, record);
            fields.put(FIELD_PROFILE, record);
            log.debug("Profile {} enriched with views {}", profileId, record.keySet());
            return fields;
        } catch (Exception ex) {
            log.error("Profile enrichment failed: {}", ex.getMessage(), ex);
            return null;
        }
    }

    private Optional<Map<String, Object>> fetchView(String profileId, ProfileDirectory.View view) {
        try {
            return profileDirectory.fetchView(profileId, view)
                    .filter(JsonNode::isObject)
                    .map(node -> objectMapper.convertValue(node, MAP_TYPE));
        } catch (Exception ex) {
            log.debug("Profile view {} unavailable for {}: {}", view.path(), profileId, ex.getMessage());
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> flatten(String profileId, Map<String, Object> record) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (record.get(SYSTEM_DATA) instanceof Map<?, ?> system) {
            Map<String, Object> demographics = system.get("demographics") instanceof Map<?, ?> d
                    ? (Map<String, Object>) d
                    : Map.of();
            Object id = demographics.get("patient_id");
            fields.put("patient_id", isPresent(id) ? id : profileId);
            fields.put("patient_name", demographics.get("name"));
            fields.put("date_of_birth", demographics.get("dob"));
            fields.put("gender", demographics.get("gender"));
            fields.put("address", demographics.get("address"));
            fields.put("phone", demographics.get("phone"));
            fields.put("email", demographics.get("email"));
        }
        if (record.get(HEALTH_PLAN_DATA) instanceof Map<?, ?> plan) {
            fields.put("insurance_carrier", plan.get("carrier"));
            fields.put("member_id", plan.get("member_id"));
            fields.put("group_number", plan.get("group"));
            fields.put("coverage_status", plan.get("eligibility") instanceof Map<?, ?> eligibility
                    ? eligibility.get("status")
                    : null);
        }
        return fields;
    }

    /**
     * True for values worth merging into known context: not null, not blank, not an empty
     * collection or map.
     */
    public static boolean isPresent(@Nullable Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !text.toString().isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof java.util.Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }
}
