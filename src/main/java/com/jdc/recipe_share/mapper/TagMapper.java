package com.jdc.recipe_share.mapper;

import com.jdc.recipe_share.domain.dto.tag.TagDto;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeTag;
import com.jdc.recipe_share.domain.entity.Tag;

import java.util.List;

public class TagMapper {

    public static TagDto toDto(Tag tag) {
        return TagDto.builder()
                .id(tag.getId())
                .name(tag.getName())
                .color(tag.getColor())
                .slug(tag.getSlug())
                .build();
    }

    public static RecipeTag toRecipeTag(Recipe recipe, Tag tag) {
        return RecipeTag.builder()
                .recipe(recipe)
                .tag(tag)
                .build();
    }

    public static List<TagDto> toDtoList(List<RecipeTag> recipeTags) {
        return recipeTags.stream()
                .map(rt -> toDto(rt.getTag()))
                .toList();
    }
}
