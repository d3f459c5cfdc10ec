package com.pressroom.api.error;

public record ErrorResponse(String code, String message) {}
