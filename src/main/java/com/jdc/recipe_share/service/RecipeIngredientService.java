package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeIngredientRequestDto;
import com.jdc.recipe_share.domain.entity.Ingredient;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeIngredient;
import com.jdc.recipe_share.domain.repository.IngredientRepository;
import com.jdc.recipe_share.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.RecipeIngredientMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * 재료 ID 중복, 수량(1 이상), 존재 여부를 검사한 뒤 저장한다.
     */
    public List<RecipeIngredient> saveAll(Recipe recipe, List<RecipeIngredientRequestDto> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "재료를 하나 이상 입력해야 합니다.");
        }

        Set<Long> seen = new HashSet<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            if (dto.getAmount() == null || dto.getAmount() < 1) {
                throw new CustomException(ErrorCode.INVALID_INGREDIENT_AMOUNT);
            }
            if (!seen.add(dto.getId())) {
                throw new CustomException(ErrorCode.DUPLICATE_INGREDIENT,
                        "재료가 중복되었습니다. (id: " + dto.getId() + ")");
            }
        }

        Map<Long, Ingredient> ingredientMap = ingredientRepository.findAllById(seen).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        List<RecipeIngredient> entities = new ArrayList<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            Ingredient ingredient = ingredientMap.get(dto.getId());
            if (ingredient == null) {
                throw new CustomException(ErrorCode.INGREDIENT_NOT_FOUND,
                        "재료를 찾을 수 없습니다. (id: " + dto.getId() + ")");
            }
            entities.add(RecipeIngredientMapper.toEntity(recipe, ingredient, dto.getAmount()));
        }

        return recipeIngredientRepository.saveAll(entities);
    }

    // 기존 재료를 모두 지우고 새로 저장 (전체 교체)
    @Transactional
    public List<RecipeIngredient> replaceIngredients(Recipe recipe, List<RecipeIngredientRequestDto> dtos) {
        recipeIngredientRepository.deleteByRecipeId(recipe.getId());
        return saveAll(recipe, dtos);
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
    }
}
