package com.sretoolbox.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What a client submits: {@code {operation, toolkit?, type?, payload}}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSubmission {
    String operation;
    String toolkit;
    String type;
    JsonNode payload;
}
