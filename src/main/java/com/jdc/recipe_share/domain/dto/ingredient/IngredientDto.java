package com.jdc.recipe_share.domain.dto.ingredient;

public record IngredientDto(
        Long id,
        String name,
        String measurementUnit
) { }
