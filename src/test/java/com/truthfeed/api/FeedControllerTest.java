package com.truthfeed.api;

import com.truthfeed.chain.HashChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FeedControllerTest {

    @Autowired MockMvc mvc;

    private static String subject() {
        return "org-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void appendTrustScore(String subject, double score) throws Exception {
        mvc.perform(post("/v1/feeds/trust_score/{subject}/events", subject)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_type\":\"trust_score_update\",\"payload\":{\"new_score\":" + score
                    + ",\"score_change\":0.05,\"contributing_factors\":3},\"confidence\":" + score + "}"))
            .andExpect(status().isCreated());
    }

    @Test
    void listFeeds_includesCoreFeeds() throws Exception {
        mvc.perform(get("/v1/feeds"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[*].feed_id", hasItem("feed_compliance_events_global")))
            .andExpect(jsonPath("$[*].feed_id", hasItem("feed_regulatory_updates_global")));
    }

    @Test
    @DisplayName("POST events returns the chained event with 201")
    void appendEvent_returnsCreatedEvent() throws Exception {
        String subject = subject();

        mvc.perform(post("/v1/feeds/trust_score/{subject}/events", subject)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event_type\":\"trust_score_update\",\"payload\":{\"new_score\":0.9},\"confidence\":0.9}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.feed_id").value("feed_trust_score_" + subject))
            .andExpect(jsonPath("$.subject_id").value(subject))
            .andExpect(jsonPath("$.sequence_number").value(1))
            .andExpect(jsonPath("$.previous_event_hash").value(HashChain.GENESIS))
            .andExpect(jsonPath("$.anchor_status").value("anchored"))
            .andExpect(jsonPath("$.anchor_reference", startsWith("anchor_")));
    }

    @Test
    void eventsAndVerify_walkTheChain() throws Exception {
        String subject = subject();
        appendTrustScore(subject, 0.7);
        appendTrustScore(subject, 0.75);
        appendTrustScore(subject, 0.8);

        mvc.perform(get("/v1/feeds/trust_score/{subject}/events", subject).param("since", "1").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].sequence_number").value(2));

        mvc.perform(get("/v1/feeds/trust_score/{subject}/verify", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.events_checked").value(3))
            .andExpect(jsonPath("$.verification_status").value("verified"));
    }

    @Test
    void rss_rendersNewestItemFirst() throws Exception {
        String subject = subject();
        appendTrustScore(subject, 0.61);
        appendTrustScore(subject, 0.92);

        mvc.perform(get("/v1/feeds/trust_score/{subject}/rss", subject))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("application/rss+xml"))
            .andExpect(content().string(containsString("<rss version=\"2.0\">")))
            .andExpect(content().string(containsString(
                "<item><title>Trust Score: 0.92 (+0.05)</title>")))
            .andExpect(content().string(containsString("Trust score updated to 0.61 based on 3 factors.")));
    }

    @Test
    void analytics_countsEvents() throws Exception {
        String subject = subject();
        appendTrustScore(subject, 0.6);
        appendTrustScore(subject, 0.8);

        mvc.perform(get("/v1/feeds/trust_score/{subject}/analytics", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_events").value(2))
            .andExpect(jsonPath("$.events_by_type.trust_score_update").value(2))
            .andExpect(jsonPath("$.data_integrity_score").value(1.0));
    }

    @Nested
    @DisplayName("Error responses")
    class Errors {

        @Test
        void unknownSubjectFeed_is404WithErrorBody() throws Exception {
            mvc.perform(get("/v1/feeds/audit_activities/{subject}/events", subject()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message", containsString("feed not found")))
                .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        void unknownFeedType_isInvalidArgument() throws Exception {
            mvc.perform(get("/v1/feeds/weather/events"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
        }

        @Test
        void confidenceOutOfRange_isInvalidArgument() throws Exception {
            mvc.perform(post("/v1/feeds/trust_score/{subject}/events", subject())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\":\"trust_score_update\",\"payload\":{},\"confidence\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
        }

        @Test
        @DisplayName("A subject feed named 'global' cannot shadow the global feed")
        void reservedGlobalSubject_isInvalidArgument() throws Exception {
            mvc.perform(post("/v1/feeds/trust_score/global/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\":\"trust_score_update\",\"payload\":{},\"confidence\":0.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message", containsString("reserved")));
        }

        @Test
        void malformedBody_isBadRequest() throws Exception {
            mvc.perform(post("/v1/feeds/trust_score/{subject}/events", subject())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"event_type\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }

        @Test
        void invertedAnalyticsWindow_isInvalidArgument() throws Exception {
            mvc.perform(get("/v1/feeds/compliance_events/analytics")
                    .param("from", "2026-02-01T00:00:00Z")
                    .param("to", "2026-01-01T00:00:00Z"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
        }
    }
}
