package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeFavorite;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.RecipeFavoriteRepository;
import com.jdc.recipe_share.domain.repository.RecipeRepository;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeFavoriteService {

    private final RecipeFavoriteRepository favoriteRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeShortDto addFavorite(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (favoriteRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            favoriteRepository.saveAndFlush(RecipeFavorite.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            // 동시 요청으로 유니크 제약에 걸린 경우
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE, e);
        }

        log.info("즐겨찾기 추가 - userId: {}, recipeId: {}", userId, recipeId);
        return RecipeMapper.toShortDto(recipe);
    }

    @Transactional
    public void removeFavorite(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }

        RecipeFavorite favorite = favoriteRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.FAVORITE_NOT_FOUND));

        favoriteRepository.delete(favorite);
        log.info("즐겨찾기 삭제 - userId: {}, recipeId: {}", userId, recipeId);
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        favoriteRepository.deleteByRecipeId(recipeId);
    }
}
