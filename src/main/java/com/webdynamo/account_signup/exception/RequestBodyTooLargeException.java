package com.webdynamo.account_signup.exception;

import java.io.IOException;

/**
 * Raised from the request input stream once the body crosses the configured limit.
 */
public class RequestBodyTooLargeException extends IOException {

    public RequestBodyTooLargeException(long limitBytes) {
        super("Request body exceeds " + limitBytes + " bytes");
    }
}
