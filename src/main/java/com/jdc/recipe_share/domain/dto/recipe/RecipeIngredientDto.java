package com.jdc.recipe_share.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 레시피에 포함된 재료 (재료 ID 기준)
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientDto {
    private Long id;
    private String name;
    private String measurementUnit;
    private Integer amount;
}
