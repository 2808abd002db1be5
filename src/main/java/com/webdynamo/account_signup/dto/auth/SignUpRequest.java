package com.webdynamo.account_signup.dto.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.webdynamo.account_signup.model.Secret;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * DTO for account registration.
 * Constraints are checked after {@link #normalize()}, see SignUpRequestValidator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignUpRequest {

    static final String NAME_LENGTH_MESSAGE = "names must be fewer than 128 characters";
    static final String NAME_CHARACTERS_MESSAGE = "names contain unsupported characters";
    static final String NAME_CHARACTERS = "^[^<>{}\\r\\n\\t]*$";

    @Pattern(regexp = "^[A-Za-z0-9_]{3,64}$",
            message = "username must be 3-64 characters and use letters, digits, or underscores")
    private String username;

    private Secret password;

    @Size(max = 254, message = "invalid email address")
    @Email(message = "invalid email address")
    private String email;

    @JsonProperty("first_name")
    @Size(max = 128, message = NAME_LENGTH_MESSAGE)
    @Pattern(regexp = NAME_CHARACTERS, message = NAME_CHARACTERS_MESSAGE)
    private String firstName;

    @JsonProperty("last_name")
    @Size(max = 128, message = NAME_LENGTH_MESSAGE)
    @Pattern(regexp = NAME_CHARACTERS, message = NAME_CHARACTERS_MESSAGE)
    private String lastName;

    /**
     * Trim every text field and lowercase username and email, in place.
     * Missing text fields become empty strings. Safe to call repeatedly.
     */
    public void normalize() {
        firstName = strip(firstName);
        lastName = strip(lastName);
        username = strip(username).toLowerCase(Locale.ROOT);
        email = strip(email).toLowerCase(Locale.ROOT);
    }

    private static String strip(String value) {
        if (value == null) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Unicode White_Space: space separators (no-break spaces included),
     * line and paragraph separators, TAB through CR, and NEL.
     * Unlike {@link Character#isWhitespace(char)}, U+001C..U+001F are not spaces.
     */
    static boolean isSpace(char c) {
        return Character.isSpaceChar(c) || (c >= '\t' && c <= '\r') || c == '\u0085';
    }
}
