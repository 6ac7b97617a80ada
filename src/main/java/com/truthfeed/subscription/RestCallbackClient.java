package com.truthfeed.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.truthfeed.bus.FeedEvent;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * POSTs the event as JSON. Receivers deduplicate on the event id header and
 * check the body against the signature header.
 */
@Component
public class RestCallbackClient implements CallbackClient {

    public static final String EVENT_ID_HEADER = "X-Truth-Feed-Event-Id";
    public static final String SIGNATURE_HEADER = "X-Truth-Feed-Signature";
    public static final String FEED_ID_HEADER = "X-Truth-Feed-Feed-Id";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public RestCallbackClient(RestTemplate outboundRestTemplate, ObjectMapper objectMapper) {
        this.restTemplate = outboundRestTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void deliver(String endpoint, String webhookSecret, FeedEvent event) {
        String body;
        try {
            body = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new CallbackDeliveryException("event " + event.eventId() + " cannot be serialized", ex);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_ID_HEADER, event.eventId());
        headers.set(FEED_ID_HEADER, event.feedId());
        if (webhookSecret != null) {
            headers.set(SIGNATURE_HEADER, WebhookSigner.sign(webhookSecret, body));
        }

        ResponseEntity<Void> response;
        try {
            response = restTemplate.postForEntity(endpoint, new HttpEntity<>(body, headers), Void.class);
        } catch (RestClientException ex) {
            throw new CallbackDeliveryException("callback to " + endpoint + " failed: " + ex.getMessage(), ex);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new CallbackDeliveryException("callback to " + endpoint + " returned " + response.getStatusCode());
        }
    }
}
