package com.jdc.recipe_share.domain.dto.recipe;

public record ShoppingListLine(
        String name,
        String measurementUnit,
        Long amount
) {

    public String toLine() {
        return name + "  - " + amount + "(" + measurementUnit + ")";
    }
}
