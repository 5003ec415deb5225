package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_share.domain.repository.IngredientRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.IngredientMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IngredientService {

    private final IngredientRepository ingredientRepository;

    /**
     * name 이 있으면 대소문자 구분 없이 앞글자 일치 검색, 없으면 전체. 이름순.
     */
    public List<IngredientDto> findAll(String name) {
        var ingredients = StringUtils.hasText(name)
                ? ingredientRepository.findByNameStartingWithIgnoreCaseOrderByNameAsc(name.trim())
                : ingredientRepository.findAllByOrderByNameAsc();
        return ingredients.stream()
                .map(IngredientMapper::toDto)
                .toList();
    }

    public IngredientDto findById(Long id) {
        return ingredientRepository.findById(id)
                .map(IngredientMapper::toDto)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }
}
