package com.jdc.recipe_share.domain.dto.user;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * 구독한 작성자 + 작성자의 레시피 목록
 */
@Getter
@SuperBuilder
@NoArgsConstructor
public class SubscriptionDto extends UserDto {
    private List<RecipeShortDto> recipes;
    private Long recipesCount;
}
