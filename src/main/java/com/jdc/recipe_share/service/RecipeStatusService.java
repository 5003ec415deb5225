package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeStatusDto;
import com.jdc.recipe_share.domain.repository.RecipeFavoriteRepository;
import com.jdc.recipe_share.domain.repository.ShoppingCartItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Service
@RequiredArgsConstructor
public class RecipeStatusService {

    private final RecipeFavoriteRepository recipeFavoriteRepository;
    private final ShoppingCartItemRepository shoppingCartItemRepository;

    /**
     * 레시피 목록의 즐겨찾기/장바구니 여부를 한 번에 조회한다. 비로그인이면 모두 false.
     */
    @Transactional(readOnly = true)
    public Map<Long, RecipeStatusDto> getStatuses(List<Long> recipeIds, Long userId) {
        if (recipeIds == null || recipeIds.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<Long, RecipeStatusDto> statusMap = new HashMap<>();
        if (userId == null) {
            for (Long recipeId : recipeIds) {
                statusMap.put(recipeId, RecipeStatusDto.none());
            }
            return statusMap;
        }

        Set<Long> favoritedRecipeIds = recipeFavoriteRepository.findRecipeIdsByUserIdAndRecipeIdIn(userId, recipeIds);
        Set<Long> cartRecipeIds = shoppingCartItemRepository.findRecipeIdsByUserIdAndRecipeIdIn(userId, recipeIds);

        for (Long recipeId : recipeIds) {
            statusMap.put(recipeId, RecipeStatusDto.builder()
                    .favorited(favoritedRecipeIds.contains(recipeId))
                    .inShoppingCart(cartRecipeIds.contains(recipeId))
                    .build());
        }
        return statusMap;
    }
}
