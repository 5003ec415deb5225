package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.entity.RecipeTag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecipeTagRepository extends JpaRepository<RecipeTag, Long> {

    @Query("SELECT rt FROM RecipeTag rt JOIN FETCH rt.tag WHERE rt.recipe.id IN :recipeIds ORDER BY rt.id")
    List<RecipeTag> findByRecipeIdIn(@Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeTag rt WHERE rt.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
