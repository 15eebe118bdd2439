package com.example.media_registry.util;

import org.springframework.web.server.ResponseStatusException;

/**
 * Status exception tagged with its {@link RegistryErrorKind}. Unchecked, so throwing it
 * inside a transactional operation rolls back every pending write of that call.
 */
public class RegistryException extends ResponseStatusException {
    private final RegistryErrorKind kind;
    private final String detail;

    public RegistryException(RegistryErrorKind kind, String detail) {
        super(kind.status(), kind.code());
        this.kind = kind;
        this.detail = detail;
    }

    public RegistryErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
