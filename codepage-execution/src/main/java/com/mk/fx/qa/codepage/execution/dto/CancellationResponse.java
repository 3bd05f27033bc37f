package com.mk.fx.qa.codepage.execution.dto;

public record CancellationResponse(String testId, boolean cancelled, String message) {}
