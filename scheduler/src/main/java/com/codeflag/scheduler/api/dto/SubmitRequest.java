package com.codeflag.scheduler.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /submit.
 *
 * Required: code, language
 * Optional: settings, an opaque token from the settings encryption tool.
 *   Kept as a raw node so a non-string value can be rejected explicitly
 *   instead of being coerced.
 */
public record SubmitRequest(String code, String language, JsonNode settings) {

    public boolean hasSettings() {
        return settings != null && !settings.isNull() && !settings.isMissingNode();
    }
}
