package com.jdc.recipe_share.domain.dto.recipe;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientRequestDto {

    @NotNull(message = "재료 ID는 필수입니다.")
    private Long id;

    @NotNull(message = "재료의 양은 필수입니다.")
    @Min(value = 1, message = "재료의 양은 1 이상이어야 합니다.")
    private Integer amount;
}
