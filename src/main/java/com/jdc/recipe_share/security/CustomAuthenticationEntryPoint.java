package com.jdc.recipe_share.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.exception.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {
        log.warn("인증 실패 - 요청 경로: {} {}", request.getMethod(), request.getRequestURI());
        writeUnauthorized(response, objectMapper, ErrorResponse.of(ErrorCode.UNAUTHORIZED));
    }

    public static void writeUnauthorized(HttpServletResponse response, ObjectMapper objectMapper,
                                  ErrorResponse body) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
