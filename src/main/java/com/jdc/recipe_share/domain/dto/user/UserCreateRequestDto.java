package com.jdc.recipe_share.domain.dto.user;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserCreateRequestDto {

    @NotBlank(message = "이메일은 필수입니다.")
    @Email(message = "이메일 형식이 올바르지 않습니다.")
    @Size(max = 254, message = "이메일은 254자를 넘을 수 없습니다.")
    private String email;

    @NotBlank(message = "사용자 이름은 필수입니다.")
    @Size(max = 150, message = "사용자 이름은 150자를 넘을 수 없습니다.")
    @Pattern(regexp = "^[\\w.@+-]+$", message = "사용자 이름에는 문자, 숫자, @/./+/-/_ 만 사용할 수 있습니다.")
    private String username;

    @NotBlank(message = "이름은 필수입니다.")
    @Size(max = 150, message = "이름은 150자를 넘을 수 없습니다.")
    private String firstName;

    @NotBlank(message = "성은 필수입니다.")
    @Size(max = 150, message = "성은 150자를 넘을 수 없습니다.")
    private String lastName;

    @NotBlank(message = "비밀번호는 필수입니다.")
    @Size(min = 8, max = 150, message = "비밀번호는 8자 이상 150자 이하여야 합니다.")
    private String password;
}
