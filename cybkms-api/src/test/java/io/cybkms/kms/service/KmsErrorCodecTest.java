/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class KmsErrorCodecTest {

    private final KmsErrorCodec codec = new KmsErrorCodec();

    @ParameterizedTest
    @EnumSource(KmsErrorType.class)
    void everyKindSurvivesTheWire(KmsErrorType type) {
        var exception = type.newException("boom");

        var decoded = codec.decode(codec.encode(exception));

        assertThat(decoded).isExactlyInstanceOf(exception.getClass());
        assertThat(decoded.errorType()).isEqualTo(type);
        assertThat(decoded.getMessage()).isEqualTo(type == KmsErrorType.THROTTLING ? "Request throttled" : "boom");
    }

    @Test
    void encodesTypeAndMessage() {
        assertThat(codec.encode(NotFoundException.forKey("k")))
                .isEqualTo("{\"type\":\"NotFoundException\",\"message\":\"Key 'k' not found\"}");
    }

    @Test
    void throttlingCarriesFixedMessage() {
        assertThat(codec.toError(new ThrottlingException()))
                .isEqualTo(new KmsErrorCodec.KmsError("ThrottlingException", "Request throttled"));
        assertThat(codec.decode("{\"type\":\"ThrottlingException\",\"message\":\"slow down\"}").getMessage())
                .isEqualTo("Request throttled");
    }

    @Test
    void unknownTypeDecodesToInternal() {
        var decoded = codec.decode("{\"type\":\"QuotaExceededException\",\"message\":\"too many\"}");

        assertThat(decoded).isExactlyInstanceOf(InternalException.class)
                .hasMessage("Unknown error type: QuotaExceededException");
        assertThat(decoded.errorType()).isEqualTo(KmsErrorType.INTERNAL);
    }

    @Test
    void loadFailureEncodesAsInternal() {
        assertThat(codec.toError(new KeyStoreLoadException("bad file")).type()).isEqualTo("InternalException");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = { "", "not json", "[]", "{\"message\":\"no type\"}", "{\"type\":42}" })
    void malformedPayloadDecodesToInternal(String payload) {
        assertThat(codec.decode(payload)).isExactlyInstanceOf(InternalException.class);
    }

    @Test
    void missingMessageDecodesAsEmpty() {
        assertThat(codec.decode("{\"type\":\"AccessDeniedException\"}"))
                .isExactlyInstanceOf(AccessDeniedException.class)
                .hasMessage("");
    }
}
