package com.codeflag.scheduler.api.dto;

/** Response body for a successful POST /submit. */
public record SubmitResponse(String flag) {}
