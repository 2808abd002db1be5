package com.webdynamo.account_signup.exception;

import com.webdynamo.account_signup.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.nio.charset.StandardCharsets;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String ACCOUNT_EXISTS = "account exists, please sign in";
    static final String SIGNUP_UNAVAILABLE = "signup unavailable";

    private static final MediaType JSON_UTF8 = new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8);

    /**
     * Handle undecodable bodies and failed field validation
     */
    @ExceptionHandler(InvalidSignUpRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidSignUpRequestException ex) {
        log.warn("Invalid signup request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handle missing or unreadable bodies, including bodies cut off by the size limit
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof RequestBodyTooLargeException tooLarge) {
            return handleTooLarge(tooLarge);
        }
        log.warn("Unreadable request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid request body");
    }

    /**
     * Handle body size limit crossed while streaming
     */
    @ExceptionHandler(RequestBodyTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(RequestBodyTooLargeException ex) {
        log.warn("Request body too large: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "request body too large");
    }

    /**
     * Handle duplicate username
     */
    @ExceptionHandler(UserAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleUserExists(UserAlreadyExistsException ex) {
        log.warn("Signup conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ACCOUNT_EXISTS);
    }

    /**
     * Handle wrong HTTP method
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not allowed: {}", ex.getMethod());
        HttpHeaders headers = new HttpHeaders();
        if (ex.getSupportedHttpMethods() != null) {
            headers.setAllow(ex.getSupportedHttpMethods());
        }
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .headers(headers)
                .contentType(JSON_UTF8)
                .body(new ErrorResponse("method not allowed"));
    }

    /**
     * Handle unknown paths
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex) {
        log.debug("No resource: {}", ex.getResourcePath());
        return error(HttpStatus.NOT_FOUND, "not found");
    }

    /**
     * Handle lookup, hashing and insert failures
     */
    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<ErrorResponse> handleRegistrationFailure(RegistrationException ex) {
        log.error("Registration failed: ", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, SIGNUP_UNAVAILABLE);
    }

    /**
     * Handle database/data access errors that escaped the service
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException ex) {
        log.error("Database exception: ", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, SIGNUP_UNAVAILABLE);
    }

    /**
     * Catch-all for any other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected exception: ", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, SIGNUP_UNAVAILABLE);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(JSON_UTF8)
                .body(new ErrorResponse(message));
    }
}
