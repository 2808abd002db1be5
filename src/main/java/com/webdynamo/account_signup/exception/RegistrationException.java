package com.webdynamo.account_signup.exception;

/**
 * Infrastructure failure while registering a user (lookup, hashing or insert).
 * Details are for the logs only.
 * Response: 500 Internal Server Error - "signup unavailable"
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String step, Throwable cause) {
        super(step + ": " + cause.getMessage(), cause);
    }
}
