package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.dto.recipe.ShoppingListLine;
import com.jdc.recipe_share.domain.entity.RecipeIngredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecipeIngredientRepository extends JpaRepository<RecipeIngredient, Long> {

    @Query("SELECT ri FROM RecipeIngredient ri JOIN FETCH ri.ingredient WHERE ri.recipe.id IN :recipeIds ORDER BY ri.id")
    List<RecipeIngredient> findByRecipeIdIn(@Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeIngredient ri WHERE ri.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    /**
     * 장바구니에 담긴 모든 레시피의 재료를 (이름, 단위) 별로 합산한다.
     */
    @Query("""
                SELECT new com.jdc.recipe_share.domain.dto.recipe.ShoppingListLine(
                    i.name, i.measurementUnit, SUM(ri.amount))
                FROM RecipeIngredient ri
                JOIN ri.ingredient i
                WHERE ri.recipe.id IN (
                    SELECT c.recipe.id FROM ShoppingCartItem c WHERE c.user.id = :userId
                )
                GROUP BY i.name, i.measurementUnit
                ORDER BY i.name ASC, i.measurementUnit ASC
            """)
    List<ShoppingListLine> sumAmountsInShoppingCart(@Param("userId") Long userId);
}
