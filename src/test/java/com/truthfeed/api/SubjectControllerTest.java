package com.truthfeed.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SubjectControllerTest {

    @Autowired MockMvc mvc;

    private static String subject() {
        return "org-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    void attestationAndExpertValidation_updateTrustScore() throws Exception {
        String subject = subject();

        mvc.perform(post("/v1/subjects/{id}/attestations", subject)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"attestation_type\":\"compliance\",\"score\":0.9,\"source\":\"soc2-audit\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.trust_score", closeTo(0.9, 1e-9)))
            .andExpect(jsonPath("$.attestations[0].weight").value(0.4));

        mvc.perform(post("/v1/subjects/{id}/expert-validations", subject)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expert_id\":\"expert-7\",\"expert_credentials\":[\"CISA\"],"
                    + "\"confidence\":0.8,\"stake\":600}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.trust_score", closeTo(0.84, 1e-9)));

        mvc.perform(get("/v1/subjects/{id}/trust-score", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.has_evidence").value(true))
            .andExpect(jsonPath("$.attestation_count").value(1))
            .andExpect(jsonPath("$.expert_validation_count").value(1))
            .andExpect(jsonPath("$.temporal_integrity_score").value(1.0))
            .andExpect(jsonPath("$.verification_status").value("verified"));

        mvc.perform(get("/v1/subjects/{id}/integrity", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry_count").value(2))
            .andExpect(jsonPath("$.entries[0].status").value("confirmed"));

        mvc.perform(get("/v1/subjects/{id}/integrity/verify", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.entries_checked").value(2));
    }

    @Test
    void subjectWithoutEvidence_hasZeroScore() throws Exception {
        mvc.perform(get("/v1/subjects/{id}/trust-score", subject()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.trust_score").value(0.0))
            .andExpect(jsonPath("$.has_evidence").value(false))
            .andExpect(jsonPath("$.verification_status").value("pending"));
    }

    @Test
    void unknownSubjectIntegrity_is404() throws Exception {
        mvc.perform(get("/v1/subjects/{id}/integrity", subject()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    void unknownAttestationType_isBadRequest() throws Exception {
        mvc.perform(post("/v1/subjects/{id}/attestations", subject())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"attestation_type\":\"gossip\",\"score\":0.9}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void missingStake_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/subjects/{id}/expert-validations", subject())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expert_id\":\"expert-7\",\"confidence\":0.8}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }
}
