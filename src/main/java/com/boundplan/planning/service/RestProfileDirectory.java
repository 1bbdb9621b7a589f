package com.boundplan.planning.service;

import com.boundplan.planning.api.ProfileDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ProfileDirectory} backed by the user-profile HTTP API. Transport and server errors
 * propagate; a 404 on a view means the view does not exist.
 */
@Service
@Slf4j
public class RestProfileDirectory implements ProfileDirectory {

    private final RestClient restClient;

    public RestProfileDirectory(@Qualifier("profileDirectoryRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<String> search(String nameOrId) {
        JsonNode response = restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/search").queryParam("name", nameOrId).build())
                .retrieve()
                .body(JsonNode.class);
        List<String> ids = new ArrayList<>();
        if (response == null) {
            return ids;
        }
        for (JsonNode patient : response.path("patients")) {
            String id = patient.path("patient_id").asText(null);
            if (StringUtils.hasText(id)) {
                ids.add(id);
            }
        }
        log.debug("Profile search returned {} match(es)", ids.size());
        return ids;
    }

    @Override
    public Optional<JsonNode> fetchView(String profileId, View view) {
        try {
            JsonNode body = restClient.get()
                    .uri("/{id}/{view}", profileId, view.path())
                    .retrieve()
                    .body(JsonNode.class);
            return Optional.ofNullable(body);
        } catch (HttpClientErrorException.NotFound ex) {
            log.debug("Profile view {} not found for {}", view.path(), profileId);
            return Optional.empty();
        }
    }
}
