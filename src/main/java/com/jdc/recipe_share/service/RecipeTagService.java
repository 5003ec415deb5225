package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeTag;
import com.jdc.recipe_share.domain.entity.Tag;
import com.jdc.recipe_share.domain.repository.RecipeTagRepository;
import com.jdc.recipe_share.domain.repository.TagRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.TagMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeTagService {

    private final TagRepository tagRepository;
    private final RecipeTagRepository recipeTagRepository;

    public List<RecipeTag> saveAll(Recipe recipe, List<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "태그를 하나 이상 선택해야 합니다.");
        }

        Set<Long> distinct = new LinkedHashSet<>(tagIds);
        if (distinct.size() != tagIds.size()) {
            throw new CustomException(ErrorCode.DUPLICATE_TAG);
        }

        Map<Long, Tag> tagMap = tagRepository.findAllById(distinct).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        List<RecipeTag> recipeTags = new ArrayList<>();
        for (Long tagId : tagIds) {
            Tag tag = tagMap.get(tagId);
            if (tag == null) {
                // 존재하지 않는 태그는 입력 오류로 본다
                throw new CustomException(ErrorCode.INVALID_TAG, "존재하지 않는 태그입니다. (id: " + tagId + ")");
            }
            recipeTags.add(TagMapper.toRecipeTag(recipe, tag));
        }

        return recipeTagRepository.saveAll(recipeTags);
    }

    @Transactional
    public List<RecipeTag> replaceTags(Recipe recipe, List<Long> tagIds) {
        recipeTagRepository.deleteByRecipeId(recipe.getId());
        return saveAll(recipe, tagIds);
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeTagRepository.deleteByRecipeId(recipeId);
    }
}
