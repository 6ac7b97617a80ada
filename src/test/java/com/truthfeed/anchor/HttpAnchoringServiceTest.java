package com.truthfeed.anchor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpAnchoringServiceTest {

    private static final String ENDPOINT = "https://anchor.example.com/v1/anchors";
    private static final String HASH = "ab".repeat(32);

    private MockRestServiceServer server;
    private HttpAnchoringService service;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        service = new HttpAnchoringService(restTemplate, ENDPOINT);
    }

    @Test
    void anchor_returnsReference() {
        server.expect(requestTo(ENDPOINT))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().json("{\"hash\":\"" + HASH + "\"}"))
            .andRespond(withSuccess("{\"reference\":\"tx_0042\"}", MediaType.APPLICATION_JSON));

        assertEquals("tx_0042", service.anchor(HASH));
        server.verify();
    }

    @Test
    void anchor_serverErrorIsUnavailable() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThrows(AnchoringUnavailableException.class, () -> service.anchor(HASH));
    }

    @Test
    void anchor_missingReferenceIsUnavailable() {
        server.expect(requestTo(ENDPOINT))
            .andRespond(withStatus(HttpStatus.OK).contentType(MediaType.APPLICATION_JSON).body("{}"));

        assertThrows(AnchoringUnavailableException.class, () -> service.anchor(HASH));
    }
}
