package com.webdynamo.account_signup.dto;

public record MessageResponse(String message) {
}
