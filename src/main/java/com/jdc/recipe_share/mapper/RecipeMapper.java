package com.jdc.recipe_share.mapper;

import com.jdc.recipe_share.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeIngredientDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.domain.dto.tag.TagDto;
import com.jdc.recipe_share.domain.dto.user.UserDto;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.User;

import java.util.List;

public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto, User author, String image) {
        return Recipe.builder()
                .author(author)
                .name(dto.getName())
                .text(dto.getText())
                .cookingTime(dto.getCookingTime())
                .image(image)
                .build();
    }

    public static RecipeShortDto toShortDto(Recipe recipe) {
        return RecipeShortDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .image(recipe.getImage())
                .cookingTime(recipe.getCookingTime())
                .build();
    }

    public static List<RecipeShortDto> toShortDtoList(List<Recipe> recipes) {
        return recipes.stream()
                .map(RecipeMapper::toShortDto)
                .toList();
    }

    public static RecipeDetailDto toDetailDto(Recipe recipe,
                                              List<TagDto> tags,
                                              UserDto author,
                                              List<RecipeIngredientDto> ingredients,
                                              boolean favorited,
                                              boolean inShoppingCart) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .tags(tags)
                .author(author)
                .ingredients(ingredients)
                .isFavorited(favorited)
                .isInShoppingCart(inShoppingCart)
                .name(recipe.getName())
                .image(recipe.getImage())
                .text(recipe.getText())
                .cookingTime(recipe.getCookingTime())
                .build();
    }
}
