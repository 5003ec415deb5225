package com.jdc.recipe_share.domain.dto.recipe;

import lombok.Builder;
import lombok.Getter;

/**
 * 현재 사용자 기준 레시피 상태
 */
@Getter
@Builder
public class RecipeStatusDto {

    private static final RecipeStatusDto NONE = RecipeStatusDto.builder().build();

    private final boolean favorited;
    private final boolean inShoppingCart;

    public static RecipeStatusDto none() {
        return NONE;
    }
}
