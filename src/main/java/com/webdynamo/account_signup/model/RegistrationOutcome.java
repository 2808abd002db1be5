package com.webdynamo.account_signup.model;

public enum RegistrationOutcome {
    CREATED,
    DUPLICATE,
    FAILED
}
