package com.mk.fx.qa.codepage.execution.dto;

/** Outcome of a bulk deletion. */
public record DeletionResponse(int deleted, String message) {}
