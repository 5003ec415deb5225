package com.jdc.recipe_share.service;

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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShoppingCartServiceTest {

    @Mock
    private ShoppingCartItemRepository cartItemRepository;
    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;
    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private ShoppingCartService shoppingCartService;

    @Test
    @DisplayName("addToCart: 장바구니에 없으면 저장한다")
    void addToCart_saves() {
        Recipe recipe = Recipe.builder().id(3L).name("스콘").cookingTime(40).build();
        when(recipeRepository.findById(3L)).thenReturn(Optional.of(recipe));
        when(cartItemRepository.existsByUserIdAndRecipeId(1L, 3L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(User.builder().id(1L).build()));
        when(cartItemRepository.saveAndFlush(any(ShoppingCartItem.class))).thenAnswer(inv -> inv.getArgument(0));

        var result = shoppingCartService.addToCart(1L, 3L);

        assertThat(result.getId()).isEqualTo(3L);
        verify(cartItemRepository).saveAndFlush(any(ShoppingCartItem.class));
    }

    @Test
    @DisplayName("addToCart: 이미 담긴 레시피면 ALREADY_IN_SHOPPING_CART")
    void addToCart_duplicate() {
        when(recipeRepository.findById(3L)).thenReturn(Optional.of(Recipe.builder().id(3L).build()));
        when(cartItemRepository.existsByUserIdAndRecipeId(1L, 3L)).thenReturn(true);

        assertThatThrownBy(() -> shoppingCartService.addToCart(1L, 3L))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_IN_SHOPPING_CART);
    }

    @Test
    @DisplayName("removeFromCart: 담기지 않은 레시피면 SHOPPING_CART_ITEM_NOT_FOUND")
    void removeFromCart_missing() {
        when(recipeRepository.existsById(3L)).thenReturn(true);
        when(cartItemRepository.findByUserIdAndRecipeId(1L, 3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> shoppingCartService.removeFromCart(1L, 3L))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.SHOPPING_CART_ITEM_NOT_FOUND);
        verify(cartItemRepository, never()).delete(any());
    }

    @Test
    @DisplayName("removeFromCart: 레시피가 없으면 RECIPE_NOT_FOUND")
    void removeFromCart_recipeNotFound() {
        when(recipeRepository.existsById(3L)).thenReturn(false);

        assertThatThrownBy(() -> shoppingCartService.removeFromCart(1L, 3L))
                .isInstanceOf(CustomException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.RECIPE_NOT_FOUND);
        verifyNoInteractions(cartItemRepository);
    }

    @Test
    @DisplayName("renderShoppingList: 합산된 재료를 한 줄씩 '이름  - 합계(단위)' 로 출력한다")
    void renderShoppingList_formatsLines() {
        when(recipeIngredientRepository.sumAmountsInShoppingCart(1L)).thenReturn(List.of(
                new ShoppingListLine("flour", "g", 300L),
                new ShoppingListLine("milk", "ml", 250L)
        ));

        String text = shoppingCartService.renderShoppingList(1L);

        assertThat(text).isEqualTo("flour  - 300(g)\nmilk  - 250(ml)\n");
    }

    @Test
    @DisplayName("renderShoppingList: 장바구니가 비어 있으면 빈 문서")
    void renderShoppingList_empty() {
        when(recipeIngredientRepository.sumAmountsInShoppingCart(1L)).thenReturn(List.of());

        assertThat(shoppingCartService.renderShoppingList(1L)).isEmpty();
    }
}
