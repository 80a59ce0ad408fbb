package com.codeflag.scheduler.api.dto;

/** Body of every non-2xx response. */
public record ErrorResponse(String detail) {}
