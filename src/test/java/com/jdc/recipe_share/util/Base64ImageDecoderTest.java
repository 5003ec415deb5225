package com.jdc.recipe_share.util;

import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Base64ImageDecoderTest {

    @Test
    @DisplayName("data URI 를 디코딩해 바이트와 확장자를 반환한다")
    void decode_png() {
        String payload = Base64.getEncoder().encodeToString("fake-png".getBytes(StandardCharsets.UTF_8));

        Base64ImageDecoder.DecodedImage image = Base64ImageDecoder.decode("data:image/png;base64," + payload);

        assertThat(image.extension()).isEqualTo("png");
        assertThat(new String(image.bytes(), StandardCharsets.UTF_8)).isEqualTo("fake-png");
    }

    @ParameterizedTest
    @CsvSource({"jpeg,jpg", "JPEG,jpg", "png,png", "gif,gif", "svg+xml,svg", "webp,webp"})
    @DisplayName("MIME subtype 으로 확장자를 정한다")
    void extensionOf(String subtype, String expected) {
        assertThat(Base64ImageDecoder.extensionOf(subtype)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not-a-data-uri",
            "data:text/plain;base64,aGVsbG8=",
            "data:image/png,aGVsbG8=",
            "data:image/png;base64,@@@",
            "data:image/png;base64,"
    })
    @DisplayName("형식이 잘못된 data URI 는 INVALID_RECIPE_IMAGE")
    void decode_malformed(String value) {
        assertThatThrownBy(() -> Base64ImageDecoder.decode(value))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_RECIPE_IMAGE);
    }

    @Test
    @DisplayName("isDataUri: data: 로 시작하는 값만 data URI 로 본다")
    void isDataUri() {
        assertThat(Base64ImageDecoder.isDataUri("data:image/png;base64,AAAA")).isTrue();
        assertThat(Base64ImageDecoder.isDataUri("/media/recipes/a.png")).isFalse();
        assertThat(Base64ImageDecoder.isDataUri(null)).isFalse();
    }
}
