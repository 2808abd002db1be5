package com.webdynamo.account_signup.controller;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.webdynamo.account_signup.dto.auth.SignUpRequest;
import com.webdynamo.account_signup.exception.InvalidSignUpRequestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Strict decoder for signup bodies: exactly one JSON object, no unknown
 * fields, nothing after it.
 */
@Component
@Slf4j
public class SignUpRequestReader {

    static final String INVALID_BODY = "invalid request body";
    static final String TRAILING_DATA = "unexpected trailing data";

    private final ObjectReader reader;

    public SignUpRequestReader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(SignUpRequest.class)
                .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public SignUpRequest read(byte[] body) {
        try (JsonParser parser = reader.createParser(body)) {
            SignUpRequest request = decode(parser);
            ensureEndOfInput(parser);
            return request;
        } catch (IOException e) {
            throw new InvalidSignUpRequestException(INVALID_BODY, e);
        }
    }

    private SignUpRequest decode(JsonParser parser) {
        SignUpRequest request;
        try {
            request = reader.readValue(parser);
        } catch (IOException e) {
            log.debug("Rejected signup body: {}", e.getClass().getSimpleName());
            throw new InvalidSignUpRequestException(INVALID_BODY, e);
        }
        if (request == null) {
            throw new InvalidSignUpRequestException(INVALID_BODY);
        }
        return request;
    }

    private void ensureEndOfInput(JsonParser parser) {
        try {
            if (parser.nextToken() != null) {
                throw new InvalidSignUpRequestException(TRAILING_DATA);
            }
        } catch (IOException e) {
            throw new InvalidSignUpRequestException(TRAILING_DATA, e);
        }
    }
}
