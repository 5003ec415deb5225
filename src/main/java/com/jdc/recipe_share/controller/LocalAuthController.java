package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.jwt.JwtTokenProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "로컬 인증 테스트", description = "로컬 개발 환경에서 사용자 ID로 액세스 토큰을 발급합니다.")
@RestController
@Profile("local")
@RequiredArgsConstructor
public class LocalAuthController {

    private final JwtTokenProvider jwtTokenProvider;
    private final UserRepository userRepository;

    @Operation(summary = "로컬 테스트용 액세스 토큰 발급", description = "지정한 userId로 JWT 액세스 토큰을 발급하고 accessToken 쿠키에도 담습니다.")
    @GetMapping("/local-token")
    public ResponseEntity<Map<String, String>> devToken(
            @Parameter(description = "사용자 ID", example = "1") @RequestParam(defaultValue = "1") Long userId) {

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        String accessToken = jwtTokenProvider.createAccessToken(user);

        ResponseCookie accessTokenCookie = ResponseCookie.from("accessToken", accessToken)
                .path("/")
                .httpOnly(true)
                .sameSite("Lax")
                .maxAge(60 * 60)
                .build();

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, accessTokenCookie.toString())
                .body(Map.of("access_token", accessToken));
    }
}
