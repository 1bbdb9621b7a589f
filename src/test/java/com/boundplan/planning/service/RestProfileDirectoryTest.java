package com.boundplan.planning.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.boundplan.planning.api.ProfileDirectory.View;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Optional;

class RestProfileDirectoryTest {

    private static final String BASE = "http://profiles.test/api/user-profiles";

    private MockRestServiceServer server;
    private RestProfileDirectory directory;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        directory = new RestProfileDirectory(builder.build());
    }

    @Test
    void testSearchReturnsIdsInOrder() {
        server.expect(requestTo(BASE + "/search?name=Jane"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"patients\": [{\"patient_id\": \"P-1\"}, {\"name\": \"no id\"}, {\"patient_id\": \"P-2\"}]}",
                        MediaType.APPLICATION_JSON));

        assertEquals(List.of("P-1", "P-2"), directory.search("Jane"));
        server.verify();
    }

    @Test
    void testFetchView() {
        server.expect(requestTo(BASE + "/P-1/health-plan"))
                .andRespond(withSuccess("{\"carrier\": \"Acme\"}", MediaType.APPLICATION_JSON));

        Optional<JsonNode> view = directory.fetchView("P-1", View.HEALTH_PLAN);

        assertEquals("Acme", view.orElseThrow().path("carrier").asText());
    }

    @Test
    void testMissingViewIsEmpty() {
        server.expect(requestTo(BASE + "/P-1/emr")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertEquals(Optional.empty(), directory.fetchView("P-1", View.CLINICAL));
    }

    @Test
    void testServerErrorPropagates() {
        server.expect(requestTo(BASE + "/P-1/system")).andRespond(withServerError());
        assertThrows(RestClientException.class, () -> directory.fetchView("P-1", View.SYSTEM));
    }
}
