package com.webdynamo.account_signup.exception;

/**
 * Thrown when a signup payload cannot be decoded or fails validation.
 * The message is returned to the client as-is.
 * Response: 400 Bad Request
 */
public class InvalidSignUpRequestException extends RuntimeException {

    public InvalidSignUpRequestException(String message) {
        super(message);
    }

    public InvalidSignUpRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
