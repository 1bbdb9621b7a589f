package com.boundplan.planning.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * External directory of person profiles, each exposed through several independent views.
 */
public interface ProfileDirectory {

    enum View {
        CLINICAL("emr"),
        SYSTEM("system"),
        HEALTH_PLAN("health-plan");

        private final String path;

        View(String path) {
            this.path = path;
        }

        public String path() {
            return path;
        }
    }

    /**
     * Searches profiles by name or identifier.
     *
     * @return Canonical identifiers of the matches, best match first. Empty if nothing matched.
     */
    List<String> search(String nameOrId);

    /**
     * Fetches one view of a profile.
     *
     * @return The view record, or empty if the view does not exist for this profile.
     */
    Optional<JsonNode> fetchView(String profileId, View view);
}
