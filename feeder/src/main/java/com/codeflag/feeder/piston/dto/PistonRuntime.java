package com.codeflag.feeder.piston.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One entry of GET /runtimes.
 * Must match the runtime objects returned by the Piston API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PistonRuntime(
        String language,
        String version,
        List<String> aliases
) {
    public List<String> aliasesOrEmpty() {
        return aliases == null ? List.of() : aliases;
    }
}
