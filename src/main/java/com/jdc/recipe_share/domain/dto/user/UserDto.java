package com.jdc.recipe_share.domain.dto.user;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
@NoArgsConstructor
public class UserDto {
    private Long id;
    private String email;
    private String username;
    private String firstName;
    private String lastName;

    @Schema(description = "현재 사용자가 이 사용자를 구독 중인지 여부 (비로그인/본인은 false)")
    private Boolean isSubscribed;
}
