package com.di.docsync.index;

import com.di.docsync.config.IndexProperties;
import com.di.docsync.exception.IndexException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpSearchIndexClient Tests")
class HttpSearchIndexClientTest {

    private static final String DOC_URL = "http://index.local:8080/document/v1/docsync/record/docid/photos:9";

    private MockRestServiceServer server;
    private HttpSearchIndexClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        IndexProperties properties = new IndexProperties();
        properties.setEndpoint("http://index.local:8080/");
        client = new HttpSearchIndexClient(restTemplate, properties);
    }

    @Test
    @DisplayName("Should POST the document fields under its id")
    void testUpsert() {
        server.expect(requestTo(DOC_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.fields.source_table").value("photos"))
                .andExpect(jsonPath("$.fields.source_id").value("9"))
                .andRespond(withSuccess("{\"id\":\"photos:9\"}", MediaType.APPLICATION_JSON));

        client.upsert("photos:9", Map.of("source_table", "photos", "source_id", "9"));

        server.verify();
    }

    @Test
    @DisplayName("Should raise IndexException when the index rejects a write")
    void testUpsert_Rejected() {
        server.expect(requestTo(DOC_URL))
                .andRespond(withServerError().body("disk full"));

        IndexException e = assertThrows(IndexException.class, () -> client.upsert("photos:9", Map.of()));

        assertTrue(e.getMessage().contains("HTTP 500"));
        assertTrue(e.getMessage().contains("disk full"));
    }

    @Test
    @DisplayName("Should DELETE by id and ignore documents already gone")
    void testDelete() {
        server.expect(requestTo(DOC_URL)).andExpect(method(HttpMethod.DELETE)).andRespond(withSuccess());
        server.expect(requestTo(DOC_URL)).andExpect(method(HttpMethod.DELETE)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        client.delete("photos:9");
        assertDoesNotThrow(() -> client.delete("photos:9"));

        server.verify();
    }

    @Test
    @DisplayName("Should raise IndexException when a delete fails")
    void testDelete_Rejected() {
        server.expect(requestTo(DOC_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(IndexException.class, () -> client.delete("photos:9"));
    }
}
