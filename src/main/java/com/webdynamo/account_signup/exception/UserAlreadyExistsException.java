package com.webdynamo.account_signup.exception;

/**
 * Thrown when the requested username is already registered,
 * either by the pre-check or by the unique constraint on insert.
 * Response: 409 Conflict - "account exists, please sign in"
 */
public class UserAlreadyExistsException extends RuntimeException {

    public UserAlreadyExistsException(String username) {
        super("User already exists: " + username);
    }

    public UserAlreadyExistsException(String username, Throwable cause) {
        super("User already exists: " + username, cause);
    }
}
