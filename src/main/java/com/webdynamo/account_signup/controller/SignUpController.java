package com.webdynamo.account_signup.controller;

import com.webdynamo.account_signup.dto.MessageResponse;
import com.webdynamo.account_signup.dto.auth.SignUpRequest;
import com.webdynamo.account_signup.service.RegistrationService;
import com.webdynamo.account_signup.service.SignUpRequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
@Slf4j
public class SignUpController {

    static final MediaType JSON_UTF8 = new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8);

    private final SignUpRequestReader requestReader;
    private final SignUpRequestValidator requestValidator;
    private final RegistrationService registrationService;

    /**
     * Register a new account.
     * The body is read raw so that framing rules (unknown fields, trailing data)
     * are enforced by {@link SignUpRequestReader} rather than the default converter.
     */
    @PostMapping("/signup")
    public ResponseEntity<MessageResponse> signUp(@RequestBody byte[] body) {
        SignUpRequest request = requestReader.read(body);
        requestValidator.normalizeAndValidate(request);

        registrationService.registerUser(request);

        log.info("Signup completed for user: {}", request.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED)
                .contentType(JSON_UTF8)
                .body(new MessageResponse("account created"));
    }
}
