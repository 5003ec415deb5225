package com.jdc.recipe_share.domain.dto.user;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SetPasswordRequestDto {

    @NotBlank(message = "새 비밀번호는 필수입니다.")
    @Size(min = 8, max = 150, message = "비밀번호는 8자 이상 150자 이하여야 합니다.")
    private String newPassword;

    @NotBlank(message = "현재 비밀번호는 필수입니다.")
    private String currentPassword;
}
