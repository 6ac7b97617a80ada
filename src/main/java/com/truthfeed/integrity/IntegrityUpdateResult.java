package com.truthfeed.integrity;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IntegrityUpdateResult(
    @JsonProperty("subject_id") String subjectId,
    @JsonProperty("entry") ChainEntry entry,
    @JsonProperty("merkle_root") String merkleRoot,
    @JsonProperty("integrity_score") double integrityScore,
    @JsonProperty("entry_count") int entryCount
) {}
