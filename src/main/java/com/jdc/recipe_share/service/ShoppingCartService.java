package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.domain.dto.recipe.ShoppingListLine;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.ShoppingCartItem;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_share.domain.repository.RecipeRepository;
import com.jdc.recipe_share.domain.repository.ShoppingCartItemRepository;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShoppingCartService {

    private final ShoppingCartItemRepository cartItemRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeShortDto addToCart(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (cartItemRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            cartItemRepository.saveAndFlush(ShoppingCartItem.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART, e);
        }

        log.info("장바구니 추가 - userId: {}, recipeId: {}", userId, recipeId);
        return RecipeMapper.toShortDto(recipe);
    }

    @Transactional
    public void removeFromCart(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }

        ShoppingCartItem item = cartItemRepository.findByUserIdAndRecipeId(userId, recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.SHOPPING_CART_ITEM_NOT_FOUND));

        cartItemRepository.delete(item);
        log.info("장바구니 삭제 - userId: {}, recipeId: {}", userId, recipeId);
    }

    /**
     * 장바구니 레시피들의 재료를 (이름, 단위) 별로 합산한 목록. 이름순.
     */
    @Transactional(readOnly = true)
    public List<ShoppingListLine> getShoppingList(Long userId) {
        return recipeIngredientRepository.sumAmountsInShoppingCart(userId);
    }

    // "밀가루  - 300(g)" 형식, 줄마다 개행
    @Transactional(readOnly = true)
    public String renderShoppingList(Long userId) {
        StringBuilder sb = new StringBuilder();
        for (ShoppingListLine line : getShoppingList(userId)) {
            sb.append(line.toLine()).append('\n');
        }
        return sb.toString();
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        cartItemRepository.deleteByRecipeId(recipeId);
    }
}
