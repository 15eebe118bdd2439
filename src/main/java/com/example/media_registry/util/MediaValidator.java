package com.example.media_registry.util;

import com.example.media_registry.model.MediaMetadata;

import java.util.List;

/**
 * Bound checks for media metadata. The {@code validate*} predicates are total: a {@code null}
 * argument is simply invalid.
 */
public final class MediaValidator {
    public static final int NAME_MAX_EXCLUSIVE = 64;
    public static final int SUMMARY_MAX_EXCLUSIVE = 128;
    public static final long BYTE_COUNT_MAX_EXCLUSIVE = 1_000_000_000L;
    public static final int LABEL_MAX_LENGTH = 32;
    public static final int LABELS_MAX = 10;
    public static final int PRINCIPAL_MAX_LENGTH = 256;

    private MediaValidator() {
    }

    public static boolean validateName(String name) {
        return name != null && !name.isEmpty() && name.length() < NAME_MAX_EXCLUSIVE;
    }

    public static boolean validateSummary(String summary) {
        return summary != null && !summary.isEmpty() && summary.length() < SUMMARY_MAX_EXCLUSIVE;
    }

    public static boolean validateByteCount(long byteCount) {
        return byteCount > 0 && byteCount < BYTE_COUNT_MAX_EXCLUSIVE;
    }

    public static boolean validateLabel(String label) {
        return label != null && !label.isEmpty() && label.length() <= LABEL_MAX_LENGTH;
    }

    public static boolean validateLabelSet(List<String> labels) {
        if (labels == null || labels.isEmpty() || labels.size() > LABELS_MAX) return false;
        for (String label : labels) {
            if (!validateLabel(label)) return false;
        }
        return true;
    }

    /**
     * Syntactic check on an identity handed over by the host.
     */
    public static boolean validatePrincipal(String principal) {
        return principal != null && !principal.isBlank() && principal.length() <= PRINCIPAL_MAX_LENGTH;
    }

    /**
     * Asserts all metadata bounds in a fixed order: name, byte count, summary, labels.
     * The summary has no error kind of its own and reports {@link RegistryErrorKind#INVALID_NAME}.
     *
     * @throws RegistryException for the first violated bound
     */
    public static void requireValid(MediaMetadata metadata) {
        if (!validateName(metadata.name())) {
            throw new RegistryException(RegistryErrorKind.INVALID_NAME, "name must be 1-63 characters");
        }
        if (!validateByteCount(metadata.byteCount())) {
            throw new RegistryException(RegistryErrorKind.INVALID_SIZE, "byteCount must be in (0, 1000000000)");
        }
        if (!validateSummary(metadata.summary())) {
            throw new RegistryException(RegistryErrorKind.INVALID_NAME, "summary must be 1-127 characters");
        }
        if (!validateLabelSet(metadata.labels())) {
            throw new RegistryException(RegistryErrorKind.MALFORMED_LABEL, "labels must be 1-10 entries of 1-32 characters");
        }
    }
}
