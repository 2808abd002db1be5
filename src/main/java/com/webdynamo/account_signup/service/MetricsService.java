package com.webdynamo.account_signup.service;

import com.webdynamo.account_signup.model.RegistrationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsService {

    static final String REGISTRATIONS = "signup.registrations";

    private final MeterRegistry meterRegistry;

    /**
     * Record the outcome of one registration attempt
     */
    public void recordRegistration(RegistrationOutcome outcome) {
        meterRegistry.counter(REGISTRATIONS,
                "outcome", outcome.name().toLowerCase(Locale.ROOT)
        ).increment();

        log.debug("Registration outcome recorded: {}", outcome);
    }
}
