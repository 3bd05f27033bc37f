package com.mk.fx.qa.codepage.execution.cfg;

/**
 * Body of every non-2xx response of the REST facade.
 *
 * @param error short title, e.g. {@code Not Found} or {@code Validation Failed}
 * @param details what was wrong with the request, or the failing lookup
 */
public record ErrorResponse(String error, String details) {}
