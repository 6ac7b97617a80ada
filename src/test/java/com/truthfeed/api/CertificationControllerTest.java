package com.truthfeed.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CertificationControllerTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper objectMapper;

    private static String subject() {
        return "org-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String issue(String subject, String body) throws Exception {
        String response = mvc.perform(post("/v1/subjects/{id}/certifications", subject)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.subject_id").value(subject))
            .andExpect(jsonPath("$.status").value("active"))
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).path("certification_id").asText();
    }

    @Test
    void issueFetchAndRenew() throws Exception {
        String subject = subject();
        String id = issue(subject, "{\"compliance_framework\":\"ISO27001\",\"certification_level\":\"advanced\","
            + "\"issuing_authority\":\"BSI\",\"evidence_links\":[\"https://evidence.example.com/iso.pdf\"],"
            + "\"validity_months\":6}");

        mvc.perform(get("/v1/certifications/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.certification_level").value("advanced"))
            .andExpect(jsonPath("$.renewal_requirements[0]").value("Management review"))
            .andExpect(jsonPath("$.renewal_count").value(0));

        mvc.perform(post("/v1/certifications/{id}/renew", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"validity_months\":12}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.renewal_count").value(1))
            .andExpect(jsonPath("$.last_renewed_at").isNotEmpty());

        mvc.perform(post("/v1/certifications/{id}/renew", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.renewal_count").value(2));

        mvc.perform(get("/v1/subjects/{id}/certifications", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].certification_id").value(id))
            .andExpect(jsonPath("$.length()").value(1));

        mvc.perform(get("/v1/subjects/{id}/integrity", subject))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry_count").value(3))
            .andExpect(jsonPath("$.entries[0].event_type").value("compliance_certification"))
            .andExpect(jsonPath("$.entries[1].event_type").value("compliance_certification_renewed"));
    }

    @Test
    void unknownCertification_is404() throws Exception {
        mvc.perform(get("/v1/certifications/{id}", "cert_missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));

        mvc.perform(post("/v1/certifications/{id}/renew", "cert_missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void unknownLevel_isBadRequest() throws Exception {
        mvc.perform(post("/v1/subjects/{id}/certifications", subject())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"compliance_framework\":\"SOC2\",\"certification_level\":\"platinum\","
                    + "\"issuing_authority\":\"AICPA\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("certification_level")));
    }

    @Test
    void validityOutOfRange_isInvalidArgument() throws Exception {
        mvc.perform(post("/v1/subjects/{id}/certifications", subject())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"compliance_framework\":\"SOC2\",\"certification_level\":\"basic\","
                    + "\"issuing_authority\":\"AICPA\",\"validity_months\":500}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void crossReference_isRecorded() throws Exception {
        mvc.perform(post("/v1/subjects/{id}/cross-references", subject())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"primary_claim\":\"MFA enforced\",\"reference_sources\":["
                    + "{\"source\":\"soc2-report\",\"supports\":true},"
                    + "{\"source\":\"pen-test\",\"supports\":true},"
                    + "{\"source\":\"helpdesk-log\",\"supports\":false}]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.verification_result").value("verified"))
            .andExpect(jsonPath("$.cross_validation_score", closeTo(2.0 / 3, 1e-9)))
            .andExpect(jsonPath("$.discrepancies[0]").value("helpdesk-log"));
    }
}
