package com.example.media_registry.util;

import org.springframework.http.HttpStatus;

/**
 * Every failure the registry can report. {@link #DUPLICATE_ENTRY}, {@link #ACCESS_RESTRICTED}
 * and {@link #VIEW_LIMITED} are reserved: no operation raises them.
 */
public enum RegistryErrorKind {
    OWNERSHIP_VIOLATION("OWNERSHIP_VIOLATION", HttpStatus.FORBIDDEN),
    ACCESS_RESTRICTED("ACCESS_RESTRICTED", HttpStatus.FORBIDDEN),
    VIEW_LIMITED("VIEW_LIMITED", HttpStatus.FORBIDDEN),
    INVALID_NAME("INVALID_NAME", HttpStatus.BAD_REQUEST),
    INVALID_SIZE("INVALID_SIZE", HttpStatus.BAD_REQUEST),
    MALFORMED_LABEL("MALFORMED_LABEL", HttpStatus.BAD_REQUEST),
    MISSING_RECORD("MISSING_RECORD", HttpStatus.NOT_FOUND),
    DUPLICATE_ENTRY("DUPLICATE_ENTRY", HttpStatus.CONFLICT);

    private final String code;
    private final HttpStatus status;

    RegistryErrorKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public HttpStatus status() {
        return status;
    }
}
