package com.libragraph.keyfile.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SensitiveBytesTest {

    @Test
    void shouldZeroWrappedArrayOnClose() {
        byte[] secret = {1, 2, 3, 4};

        try (SensitiveBytes bytes = SensitiveBytes.wrap(secret)) {
            assertThat(bytes.bytes()).isSameAs(secret);
        }

        assertThat(secret).containsOnly(0);
    }

    @Test
    void shouldZeroWhenBlockThrows() {
        byte[] secret = {9, 9, 9};

        assertThatThrownBy(() -> {
            try (SensitiveBytes ignored = SensitiveBytes.wrap(secret)) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(secret).containsOnly(0);
    }

    @Test
    void copyOfShouldLeaveSourceUntouched() {
        byte[] source = {5, 6, 7};

        SensitiveBytes copy = SensitiveBytes.copyOf(source);
        copy.close();

        assertThat(source).containsExactly(5, 6, 7);
    }

    @Test
    void copyShouldSurviveClose() {
        SensitiveBytes bytes = SensitiveBytes.wrap(new byte[]{1, 2});
        byte[] copy = bytes.copy();
        bytes.close();

        assertThat(copy).containsExactly(1, 2);
    }

    @Test
    void shouldRejectAccessAfterClose() {
        SensitiveBytes bytes = SensitiveBytes.wrap(new byte[4]);
        bytes.close();

        assertThat(bytes.isClosed()).isTrue();
        assertThatIllegalStateException().isThrownBy(bytes::bytes);
    }

    @Test
    void toStringShouldNotLeakContents() {
        SensitiveBytes bytes = SensitiveBytes.wrap(new byte[]{0x41, 0x42});

        assertThat(bytes.toString()).isEqualTo("SensitiveBytes[2 bytes]");
    }

    @Test
    void zeroShouldTolerateNull() {
        assertThatCode(() -> SensitiveBytes.zero(null)).doesNotThrowAnyException();
    }
}
