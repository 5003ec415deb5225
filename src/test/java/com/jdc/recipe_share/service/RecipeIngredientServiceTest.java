package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeIngredientRequestDto;
import com.jdc.recipe_share.domain.entity.Ingredient;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeIngredient;
import com.jdc.recipe_share.domain.repository.IngredientRepository;
import com.jdc.recipe_share.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeIngredientServiceTest {

    @Mock
    private IngredientRepository ingredientRepository;

    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;

    @InjectMocks
    private RecipeIngredientService recipeIngredientService;

    private Recipe dummyRecipe;
    private Ingredient flour;
    private Ingredient milk;

    @BeforeEach
    void setUp() {
        dummyRecipe = Recipe.builder().id(1L).name("테스트 레시피").build();
        flour = Ingredient.builder().id(10L).name("flour").measurementUnit("g").build();
        milk = Ingredient.builder().id(11L).name("milk").measurementUnit("ml").build();
    }

    @Test
    @DisplayName("saveAll: 재료와 수량을 레시피에 연결해 저장한다")
    @SuppressWarnings("unchecked")
    void saveAll_savesAll() {
        when(ingredientRepository.findAllById(anyIterable())).thenReturn(List.of(flour, milk));
        when(recipeIngredientRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        List<RecipeIngredient> saved = recipeIngredientService.saveAll(dummyRecipe, List.of(
                new RecipeIngredientRequestDto(10L, 200),
                new RecipeIngredientRequestDto(11L, 150)
        ));

        ArgumentCaptor<List<RecipeIngredient>> captor = ArgumentCaptor.forClass(List.class);
        verify(recipeIngredientRepository).saveAll(captor.capture());
        List<RecipeIngredient> entities = captor.getValue();

        assertEquals(2, saved.size());
        assertSame(dummyRecipe, entities.get(0).getRecipe());
        assertEquals("flour", entities.get(0).getIngredient().getName());
        assertEquals(200, entities.get(0).getAmount());
        assertEquals(150, entities.get(1).getAmount());
    }

    @Test
    @DisplayName("saveAll: 수량이 0 이면 INVALID_INGREDIENT_AMOUNT")
    void saveAll_zeroAmount_throws() {
        CustomException ex = assertThrows(CustomException.class, () ->
                recipeIngredientService.saveAll(dummyRecipe, List.of(new RecipeIngredientRequestDto(10L, 0))));

        assertEquals(ErrorCode.INVALID_INGREDIENT_AMOUNT, ex.getErrorCode());
        verifyNoInteractions(ingredientRepository, recipeIngredientRepository);
    }

    @Test
    @DisplayName("saveAll: 같은 재료가 두 번 들어오면 DUPLICATE_INGREDIENT")
    void saveAll_duplicateIngredient_throws() {
        CustomException ex = assertThrows(CustomException.class, () ->
                recipeIngredientService.saveAll(dummyRecipe, List.of(
                        new RecipeIngredientRequestDto(10L, 2),
                        new RecipeIngredientRequestDto(10L, 3))));

        assertEquals(ErrorCode.DUPLICATE_INGREDIENT, ex.getErrorCode());
        verify(recipeIngredientRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("saveAll: 존재하지 않는 재료 ID 면 INGREDIENT_NOT_FOUND 이고 아무것도 저장하지 않는다")
    void saveAll_unknownIngredient_throws() {
        when(ingredientRepository.findAllById(anyIterable())).thenReturn(List.of(flour));

        CustomException ex = assertThrows(CustomException.class, () ->
                recipeIngredientService.saveAll(dummyRecipe, List.of(
                        new RecipeIngredientRequestDto(10L, 2),
                        new RecipeIngredientRequestDto(999L, 3))));

        assertEquals(ErrorCode.INGREDIENT_NOT_FOUND, ex.getErrorCode());
        assertEquals(404, ex.getErrorCode().getStatus().value());
        verify(recipeIngredientRepository, never()).saveAll(anyList());
    }

    @Test
    @DisplayName("replaceIngredients: 기존 재료를 모두 삭제한 뒤 새로 저장한다")
    void replaceIngredients_deletesThenSaves() {
        when(ingredientRepository.findAllById(anyIterable())).thenReturn(List.of(milk));
        when(recipeIngredientRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        recipeIngredientService.replaceIngredients(dummyRecipe, List.of(new RecipeIngredientRequestDto(11L, 1)));

        InOrder inOrder = inOrder(recipeIngredientRepository);
        inOrder.verify(recipeIngredientRepository).deleteByRecipeId(1L);
        inOrder.verify(recipeIngredientRepository).saveAll(anyList());
    }
}
