/*
 * Copyright (c) 2026 Leandro Aguiar
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */
package io.github.leanish.sqs.hefty.receipt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReceiptHandleCodecTest {

    private final ReceiptHandleCodec codec = new ReceiptHandleCodec();

    @Test
    void wrap_roundTrip() {
        String wrapped = codec.wrap("rh1", "bucketX", "key/123");

        assertThat(codec.unwrap(wrapped))
                .isEqualTo(new ReceiptHandle(true, "rh1", "bucketX", "key/123"));
    }

    @Test
    void wrap_encodesMarkedComposite() {
        String wrapped = codec.wrap("rh1", "bucketX", "key/123");

        assertThat(new String(Base64.getDecoder().decode(wrapped), StandardCharsets.UTF_8))
                .isEqualTo("hefty-message|rh1|bucketX|key/123");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "AQEBzbVv7G8QtnKq2ZyR1zZ3x5TxhPYYZkrZ3bPHqZ8Z0OWH1rnTNQ==",
            "not base64 at all!",
            "plain-handle",
            ""})
    void unwrap_nativeHandle(String handle) {
        assertThat(codec.unwrap(handle))
                .isEqualTo(new ReceiptHandle(false, handle, "", ""));
    }

    @Test
    void unwrap_base64WithoutMarker() {
        String handle = encode("other-message|rh1|bucketX|key");

        assertThat(codec.unwrap(handle))
                .isEqualTo(ReceiptHandle.nativeHandle(handle));
    }

    @Test
    void unwrap_tooFewTokens() {
        String handle = encode("hefty-message|rh1|bucketX");

        assertThatThrownBy(() -> codec.unwrap(handle))
                .isInstanceOf(MalformedReceiptHandleException.class)
                .hasMessage("Expected number of tokens (4) not available in receipt handle, found 3");
    }

    @Test
    void unwrap_tooManyTokens() {
        String handle = encode("hefty-message|rh1|bucketX|key|extra");

        assertThatThrownBy(() -> codec.unwrap(handle))
                .isInstanceOf(MalformedReceiptHandleException.class)
                .hasMessage("Expected number of tokens (4) not available in receipt handle, found 5");
    }

    private static String encode(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }
}
