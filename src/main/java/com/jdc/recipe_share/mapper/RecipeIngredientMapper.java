package com.jdc.recipe_share.mapper;

import com.jdc.recipe_share.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.recipe_share.domain.entity.Ingredient;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeIngredient;

import java.util.List;

public class RecipeIngredientMapper {

    public static RecipeIngredient toEntity(Recipe recipe, Ingredient ingredient, Integer amount) {
        return RecipeIngredient.builder()
                .recipe(recipe)
                .ingredient(ingredient)
                .amount(amount)
                .build();
    }

    // id 는 재료(Ingredient)의 ID
    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        Ingredient ingredient = entity.getIngredient();
        return RecipeIngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .amount(entity.getAmount())
                .build();
    }

    public static List<RecipeIngredientDto> toDtoList(List<RecipeIngredient> entities) {
        return entities.stream()
                .map(RecipeIngredientMapper::toDto)
                .toList();
    }
}
