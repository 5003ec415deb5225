package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;


@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    List<Ingredient> findAllByOrderByNameAsc();

    List<Ingredient> findByNameStartingWithIgnoreCaseOrderByNameAsc(String prefix);
}
