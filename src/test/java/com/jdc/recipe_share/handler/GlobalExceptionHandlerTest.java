package com.jdc.recipe_share.handler;

import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.exception.ErrorResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handlerWithProfiles(String... profiles) {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles(profiles);
        return new GlobalExceptionHandler(environment);
    }

    @Test
    @DisplayName("local 프로필이 아니면 500 응답에 예외 정보를 노출하지 않는다")
    void handleException_hidesDetailsOutsideLocal() {
        GlobalExceptionHandler handler = handlerWithProfiles("prod");

        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("db password=secret"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getCode()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR.getCode());
        assertThat(response.getBody().getMessage())
                .doesNotContain("IllegalStateException")
                .doesNotContain("secret");
        assertThat(response.getBody().getErrorId()).isNotBlank();
    }

    @Test
    @DisplayName("프로필이 하나도 없으면 local 로 취급하지 않는다")
    void handleException_noProfile_hidesDetails() {
        GlobalExceptionHandler handler = handlerWithProfiles();

        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("boom"));

        assertThat(response.getBody().getMessage()).doesNotContain("boom");
    }

    @Test
    @DisplayName("local 프로필에서는 예외 클래스와 메시지를 함께 내려준다")
    void handleException_local_showsDetails() {
        GlobalExceptionHandler handler = handlerWithProfiles("local");

        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("boom"));

        assertThat(response.getBody().getMessage()).isEqualTo("[IllegalStateException] boom");
    }
}
