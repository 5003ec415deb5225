package com.jdc.recipe_share.mapper;

import com.jdc.recipe_share.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_share.domain.entity.Ingredient;

public class IngredientMapper {

    public static IngredientDto toDto(Ingredient entity) {
        return new IngredientDto(entity.getId(), entity.getName(), entity.getMeasurementUnit());
    }
}
