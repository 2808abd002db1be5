package com.webdynamo.account_signup.service;

import com.webdynamo.account_signup.dto.auth.SignUpRequest;
import com.webdynamo.account_signup.exception.InvalidSignUpRequestException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Annotation;
import java.util.Comparator;
import java.util.List;

/**
 * Normalizes a signup payload and reports the first rule it breaks.
 * <p>
 * Fields are checked in a fixed order (username, password, email, first name,
 * last name) so the same payload always yields the same message.
 */
@Component
@RequiredArgsConstructor
public class SignUpRequestValidator {

    static final int MIN_PASSWORD_LENGTH = 12;
    static final String PASSWORD_MESSAGE = "password must be at least 12 characters";

    // Rank of constraints reported for a single property
    private static final List<Class<? extends Annotation>> CONSTRAINT_ORDER =
            List.of(Size.class, Pattern.class, Email.class);

    private final Validator validator;

    /**
     * Normalize the request in place, then validate it.
     *
     * @throws InvalidSignUpRequestException with the first failure found
     */
    public void normalizeAndValidate(SignUpRequest request) {
        request.normalize();

        checkProperty(request, "username");
        checkPassword(request);
        checkProperty(request, "email");
        checkProperty(request, "firstName");
        checkProperty(request, "lastName");
    }

    private void checkPassword(SignUpRequest request) {
        if (request.getPassword() == null) {
            throw new InvalidSignUpRequestException(PASSWORD_MESSAGE);
        }
        String raw = request.getPassword().reveal();
        if (raw.codePointCount(0, raw.length()) < MIN_PASSWORD_LENGTH) {
            throw new InvalidSignUpRequestException(PASSWORD_MESSAGE);
        }
    }

    private void checkProperty(SignUpRequest request, String property) {
        validator.validateProperty(request, property).stream()
                .min(Comparator.comparingInt(SignUpRequestValidator::rank))
                .ifPresent(violation -> {
                    throw new InvalidSignUpRequestException(violation.getMessage());
                });
    }

    private static int rank(ConstraintViolation<SignUpRequest> violation) {
        Class<? extends Annotation> type =
                violation.getConstraintDescriptor().getAnnotation().annotationType();
        int index = CONSTRAINT_ORDER.indexOf(type);
        return index < 0 ? CONSTRAINT_ORDER.size() : index;
    }
}
