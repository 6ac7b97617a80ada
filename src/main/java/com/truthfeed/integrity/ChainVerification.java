package com.truthfeed.integrity;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.truthfeed.feed.VerificationStatus;

public record ChainVerification(
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("valid") boolean valid,
    @JsonProperty("entries_checked") int entriesChecked,
    @JsonProperty("first_invalid_index") Integer firstInvalidIndex,
    @JsonProperty("merkle_root") String merkleRoot,
    @JsonProperty("verification_status") VerificationStatus verificationStatus
) {}
