package com.truthfeed.anchor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Anchors hashes through a remote endpoint:
 * {@code POST {endpoint} {"hash": "..."}} answered by {@code {"reference": "..."}}.
 */
public class HttpAnchoringService implements AnchoringService {

    private static final Logger log = LoggerFactory.getLogger(HttpAnchoringService.class);

    private final RestTemplate restTemplate;
    private final String endpoint;

    public HttpAnchoringService(RestTemplate restTemplate, String endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public String anchor(String payloadHash) {
        Map<?, ?> response;
        try {
            response = restTemplate.postForObject(endpoint, Map.of("hash", payloadHash), Map.class);
        } catch (RestClientException ex) {
            log.warn("Anchoring endpoint {} failed: {}", endpoint, ex.getMessage());
            throw new AnchoringUnavailableException("anchoring endpoint unavailable: " + ex.getMessage(), ex);
        }
        if (response == null || !(response.get("reference") instanceof String reference) || reference.isBlank()) {
            throw new AnchoringUnavailableException("anchoring endpoint returned no reference");
        }
        return reference;
    }
}
