package com.example.media_registry.util;

import com.example.media_registry.model.MediaMetadata;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaValidatorTest {

    @Test
    void nameMustBeBetweenOneAndSixtyThreeCharacters() {
        assertThat(MediaValidator.validateName("clip.mp4")).isTrue();
        assertThat(MediaValidator.validateName("n".repeat(63))).isTrue();
        assertThat(MediaValidator.validateName("n".repeat(64))).isFalse();
        assertThat(MediaValidator.validateName("")).isFalse();
        assertThat(MediaValidator.validateName(null)).isFalse();
    }

    @Test
    void summaryMustBeBetweenOneAndOneHundredTwentySevenCharacters() {
        assertThat(MediaValidator.validateSummary("s".repeat(127))).isTrue();
        assertThat(MediaValidator.validateSummary("s".repeat(128))).isFalse();
        assertThat(MediaValidator.validateSummary("")).isFalse();
    }

    @Test
    void byteCountBoundsAreExclusive() {
        assertThat(MediaValidator.validateByteCount(1)).isTrue();
        assertThat(MediaValidator.validateByteCount(999_999_999L)).isTrue();
        assertThat(MediaValidator.validateByteCount(0)).isFalse();
        assertThat(MediaValidator.validateByteCount(-5)).isFalse();
        assertThat(MediaValidator.validateByteCount(1_000_000_000L)).isFalse();
    }

    @Test
    void labelSetNeedsOneToTenValidLabels() {
        List<String> full = Collections.nCopies(10, "l".repeat(32));
        assertThat(MediaValidator.validateLabelSet(full)).isTrue();
        assertThat(MediaValidator.validateLabelSet(List.of())).isFalse();
        assertThat(MediaValidator.validateLabelSet(null)).isFalse();
        assertThat(MediaValidator.validateLabelSet(Collections.nCopies(11, "video"))).isFalse();
        assertThat(MediaValidator.validateLabelSet(List.of("video", "l".repeat(33)))).isFalse();
        assertThat(MediaValidator.validateLabelSet(List.of("video", ""))).isFalse();
        assertThat(MediaValidator.validateLabelSet(Arrays.asList("video", null))).isFalse();
    }

    @Test
    void principalMustBeNonBlank() {
        assertThat(MediaValidator.validatePrincipal("alice")).isTrue();
        assertThat(MediaValidator.validatePrincipal("  ")).isFalse();
        assertThat(MediaValidator.validatePrincipal(null)).isFalse();
        assertThat(MediaValidator.validatePrincipal("p".repeat(257))).isFalse();
    }

    @Test
    void requireValidReportsFirstViolationInFixedOrder() {
        assertKind(new MediaMetadata("", 0, "", List.of()), RegistryErrorKind.INVALID_NAME);
        assertKind(new MediaMetadata("clip.mp4", 0, "", List.of()), RegistryErrorKind.INVALID_SIZE);
        assertKind(new MediaMetadata("clip.mp4", 1024, "", List.of()), RegistryErrorKind.INVALID_NAME);
        assertKind(new MediaMetadata("clip.mp4", 1024, "demo", List.of()), RegistryErrorKind.MALFORMED_LABEL);
        assertKind(new MediaMetadata("clip.mp4", 1024, "demo", new ArrayList<>(List.of("ok", "x".repeat(33)))),
                RegistryErrorKind.MALFORMED_LABEL);

        assertThatCode(() -> MediaValidator.requireValid(new MediaMetadata("clip.mp4", 1024, "demo", List.of("video"))))
                .doesNotThrowAnyException();
    }

    private static void assertKind(MediaMetadata metadata, RegistryErrorKind kind) {
        assertThatThrownBy(() -> MediaValidator.requireValid(metadata))
                .isInstanceOfSatisfying(RegistryException.class, ex -> assertThat(ex.getKind()).isEqualTo(kind));
    }
}
