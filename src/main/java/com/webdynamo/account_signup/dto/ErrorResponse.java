package com.webdynamo.account_signup.dto;

/**
 * Error body for every non-2xx response: {"error": "..."}
 */
public record ErrorResponse(String error) {
}
