package com.webdynamo.account_signup.service;

import com.webdynamo.account_signup.dto.auth.SignUpRequest;
import com.webdynamo.account_signup.exception.InvalidSignUpRequestException;
import com.webdynamo.account_signup.model.Secret;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignUpRequestValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static SignUpRequestValidator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = new SignUpRequestValidator(validatorFactory.getValidator());
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    private static SignUpRequest request(String username, String password, String email,
                                         String firstName, String lastName) {
        return new SignUpRequest(username, password == null ? null : Secret.of(password),
                email, firstName, lastName);
    }

    private static String rejectionOf(SignUpRequest request) {
        return assertThrows(InvalidSignUpRequestException.class,
                () -> validator.normalizeAndValidate(request)).getMessage();
    }

    @Test
    @DisplayName("Should accept and normalize a valid request")
    void validRequest_IsNormalized() {
        SignUpRequest request = request("  Bob12345 ", "supersecretpw", " Bob@Example.COM ", " Bob ", "Builder ");

        assertDoesNotThrow(() -> validator.normalizeAndValidate(request));

        assertEquals("bob12345", request.getUsername());
        assertEquals("bob@example.com", request.getEmail());
        assertEquals("Bob", request.getFirstName());
        assertEquals("Builder", request.getLastName());
    }

    @Test
    @DisplayName("Should accept a request with only username and password")
    void optionalFieldsMissing_IsValid() {
        SignUpRequest request = request("bob_1", "supersecretpw", null, null, null);

        assertDoesNotThrow(() -> validator.normalizeAndValidate(request));
    }

    @Test
    @DisplayName("Should reject usernames that are too short, too long, or use other characters")
    void badUsername_IsRejected() {
        String expected = "username must be 3-64 characters and use letters, digits, or underscores";

        assertEquals(expected, rejectionOf(request("ab", "supersecretpw", null, null, null)));
        assertEquals(expected, rejectionOf(request("a".repeat(65), "supersecretpw", null, null, null)));
        assertEquals(expected, rejectionOf(request("bob-smith", "supersecretpw", null, null, null)));
        assertEquals(expected, rejectionOf(request(null, "supersecretpw", null, null, null)));
    }

    @Test
    @DisplayName("Should check username length after trimming")
    void paddedUsername_IsTrimmedFirst() {
        assertEquals("username must be 3-64 characters and use letters, digits, or underscores",
                rejectionOf(request("   ab   ", "supersecretpw", null, null, null)));
        assertDoesNotThrow(() -> validator.normalizeAndValidate(
                request("  " + "a".repeat(64) + "  ", "supersecretpw", null, null, null)));
    }

    @Test
    @DisplayName("Should reject passwords shorter than 12 characters or missing")
    void shortPassword_IsRejected() {
        assertEquals("password must be at least 12 characters",
                rejectionOf(request("bob12345", "elevenchars", null, null, null)));
        assertEquals("password must be at least 12 characters",
                rejectionOf(request("bob12345", null, null, null, null)));
        assertDoesNotThrow(() -> validator.normalizeAndValidate(
                request("bob12345", "twelve chars", null, null, null)));
    }

    @Test
    @DisplayName("Should report the first failure only, in field order")
    void multipleFailures_ReportsFirst() {
        assertEquals("username must be 3-64 characters and use letters, digits, or underscores",
                rejectionOf(request("x", "short", "not-an-email", "<b>", null)));
        assertEquals("password must be at least 12 characters",
                rejectionOf(request("bob12345", "short", "not-an-email", "<b>", null)));
        assertEquals("invalid email address",
                rejectionOf(request("bob12345", "supersecretpw", "not-an-email", "<b>", null)));
    }

    @Test
    @DisplayName("Should reject malformed or overlong email addresses")
    void badEmail_IsRejected() {
        assertEquals("invalid email address",
                rejectionOf(request("bob12345", "supersecretpw", "not-an-email", null, null)));
        assertEquals("invalid email address",
                rejectionOf(request("bob12345", "supersecretpw", "a".repeat(250) + "@example.com", null, null)));
    }

    @Test
    @DisplayName("Should reject names with markup or control characters")
    void badNameCharacters_AreRejected() {
        String expected = "names contain unsupported characters";

        assertEquals(expected, rejectionOf(request("bob12345", "supersecretpw", null, "<script>", null)));
        assertEquals(expected, rejectionOf(request("bob12345", "supersecretpw", null, "Bob", "Smith{x}")));
        assertEquals(expected, rejectionOf(request("bob12345", "supersecretpw", null, "Bo\tb", null)));
    }

    @Test
    @DisplayName("Should reject names longer than 128 characters, reporting length before characters")
    void longName_IsRejected() {
        String expected = "names must be fewer than 128 characters";

        assertEquals(expected, rejectionOf(request("bob12345", "supersecretpw", null, "a".repeat(129), null)));
        assertEquals(expected, rejectionOf(request("bob12345", "supersecretpw", null, null, "<".repeat(129))));
        assertDoesNotThrow(() -> validator.normalizeAndValidate(
                request("bob12345", "supersecretpw", null, "a".repeat(128), null)));
    }
}
