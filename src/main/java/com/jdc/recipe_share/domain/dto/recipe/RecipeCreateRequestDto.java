package com.jdc.recipe_share.domain.dto.recipe;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

/**
 * 레시피 생성/수정용. 수정 시 ingredients, tags 는 전체 교체된다.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeCreateRequestDto {

    @NotEmpty(message = "재료를 하나 이상 입력해야 합니다.")
    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    @NotEmpty(message = "태그를 하나 이상 선택해야 합니다.")
    private List<@NotNull Long> tags;

    // data:image/png;base64,... 형식. 수정 시에는 생략 가능
    private String image;

    @NotBlank(message = "레시피 이름은 필수입니다.")
    @Size(max = 200, message = "레시피 이름은 200자를 넘을 수 없습니다.")
    private String name;

    @NotBlank(message = "레시피 설명은 필수입니다.")
    private String text;

    @NotNull(message = "조리 시간은 필수입니다.")
    @Min(value = 1, message = "조리 시간은 1분 이상이어야 합니다.")
    private Integer cookingTime;
}
