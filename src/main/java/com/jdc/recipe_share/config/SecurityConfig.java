package com.jdc.recipe_share.config;

import com.jdc.recipe_share.jwt.JwtAuthenticationFilter;
import com.jdc.recipe_share.security.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtAuthenticationFilter jwtFilter;
    private final CustomAuthenticationEntryPoint entryPoint;
    private final Environment env;

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private List<String> allowedOrigins;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        boolean local = env.acceptsProfiles(Profiles.of("local"));

        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(cors -> cors.configurationSource(corsConfig()))
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers(HttpMethod.OPTIONS, "/**").permitAll();

                    // 로컬 전용: H2 콘솔, JWT 발급용 엔드포인트
                    if (local) {
                        auth.requestMatchers("/h2-console/**", "/local-token").permitAll();
                    }

                    auth
                            // 1) 공개 엔드포인트
                            .requestMatchers(
                                    "/v3/api-docs/**",
                                    "/swagger-ui/**",
                                    "/swagger-ui.html",
                                    "/media/**",
                                    "/error"
                            ).permitAll()

                            // 2) GET 중 인증 필요 (/api/recipes/* 보다 먼저)
                            .requestMatchers(HttpMethod.GET,
                                    "/api/recipes/download_shopping_cart",
                                    "/api/users/me",
                                    "/api/users/subscriptions",
                                    "/api/users/*"
                            ).authenticated()

                            // 3) 읽기 전용 GET (모두 허용)
                            .requestMatchers(HttpMethod.GET,
                                    "/api/tags/**",
                                    "/api/ingredients/**",
                                    "/api/recipes",
                                    "/api/recipes/*",
                                    "/api/users"
                            ).permitAll()

                            // 4) 회원가입
                            .requestMatchers(HttpMethod.POST, "/api/users").permitAll()

                            // 5) 나머지 API 는 인증 필요
                            .requestMatchers("/api/**").authenticated()
                            .anyRequest().denyAll();
                })
                .exceptionHandling(e -> e.authenticationEntryPoint(entryPoint))
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);

        if (local) {
            http.headers(h -> h.frameOptions(frame -> frame.disable()));
        }
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public CorsConfigurationSource corsConfig() {
        CorsConfiguration cfg = new CorsConfiguration();
        cfg.setAllowedOriginPatterns(allowedOrigins);
        cfg.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("Content-Disposition"));
        cfg.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", cfg);
        return src;
    }
}
