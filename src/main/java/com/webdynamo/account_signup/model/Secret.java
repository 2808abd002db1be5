package com.webdynamo.account_signup.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Wraps credential material so it cannot leak through logging or JSON output.
 * The raw value is only reachable through {@link #reveal()}.
 */
public final class Secret {

    static final String REDACTED = "[REDACTED]";
    static final String REDACTED_JSON = "***redacted***";

    private final String value;

    private Secret(String value) {
        this.value = value;
    }

    /**
     * Wrap a raw secret. Also used by Jackson when reading a JSON string.
     *
     * @throws IllegalArgumentException if the value is null or empty
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Secret of(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("secret value must not be empty");
        }
        return new Secret(value);
    }

    /**
     * Raw secret value. Only the password hashing step should call this.
     */
    public String reveal() {
        return value;
    }

    @JsonValue
    public String redactedJson() {
        return REDACTED_JSON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Secret other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return REDACTED;
    }
}
