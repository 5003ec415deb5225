package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    @Query("""
                SELECT r FROM Recipe r
                JOIN FETCH r.author
                WHERE r.id = :recipeId
            """)
    Optional<Recipe> findWithAuthorById(@Param("recipeId") Long recipeId);

    Page<Recipe> findByAuthorIdOrderByCreatedAtDescIdDesc(Long authorId, Pageable pageable);

    List<Recipe> findByAuthorIdOrderByCreatedAtDescIdDesc(Long authorId);

    long countByAuthorId(Long authorId);

    @Query("SELECT r.author.id, COUNT(r) FROM Recipe r WHERE r.author.id IN :authorIds GROUP BY r.author.id")
    List<Object[]> countByAuthorIdsRaw(@Param("authorIds") Collection<Long> authorIds);

    default Map<Long, Long> countMapByAuthorIds(Collection<Long> authorIds) {
        return countByAuthorIdsRaw(authorIds).stream()
                .collect(Collectors.toMap(
                        a -> (Long) a[0],
                        a -> a[1] != null ? (Long) a[1] : 0L
                ));
    }
}
