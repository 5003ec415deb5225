package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.dto.RecipeSearchCondition;
import com.jdc.recipe_share.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RecipeQueryRepository {

    /**
     * 태그/작성자/즐겨찾기/장바구니 조건으로 레시피를 조회한다. 최신순.
     *
     * @param currentUserId 요청자 ID, 비로그인은 null (즐겨찾기·장바구니 조건 무시)
     */
    Page<Recipe> search(RecipeSearchCondition condition, Long currentUserId, Pageable pageable);
}
