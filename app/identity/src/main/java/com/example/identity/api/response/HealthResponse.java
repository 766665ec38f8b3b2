package com.example.identity.api.response;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp) {}
