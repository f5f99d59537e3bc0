package io.mixforge.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error description used for logging and JSON error bodies. */
public record ErrorDetails(
    String type,
    String message,
    MixForgeErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
