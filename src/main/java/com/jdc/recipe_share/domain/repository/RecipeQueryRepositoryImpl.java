package com.jdc.recipe_share.domain.repository;

import com.jdc.recipe_share.domain.dto.RecipeSearchCondition;
import com.jdc.recipe_share.domain.entity.*;
import com.querydsl.core.types.OrderSpecifier;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.JPAExpressions;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.support.PageableExecutionUtils;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    @Override
    public Page<Recipe> search(RecipeSearchCondition cond, Long currentUserId, Pageable pageable) {
        QRecipe recipe = QRecipe.recipe;

        BooleanExpression[] where = {
                tagSlugIn(cond.getTags()),
                authorEq(cond.getAuthor()),
                favoritedBy(cond.isFavoritedOnly() ? currentUserId : null),
                inShoppingCartOf(cond.isInShoppingCartOnly() ? currentUserId : null)
        };

        List<Recipe> content = queryFactory
                .selectFrom(recipe)
                .join(recipe.author).fetchJoin()
                .where(where)
                .orderBy(defaultOrder())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        return PageableExecutionUtils.getPage(
                content,
                pageable,
                () -> {
                    Long total = queryFactory
                            .select(recipe.count())
                            .from(recipe)
                            .where(where)
                            .fetchOne();
                    return total != null ? total : 0L;
                }
        );
    }

    private OrderSpecifier<?>[] defaultOrder() {
        QRecipe recipe = QRecipe.recipe;
        return new OrderSpecifier[]{recipe.createdAt.desc(), recipe.id.desc()};
    }

    // 여러 태그는 OR 조건. 서브쿼리로 걸러 중복 행이 생기지 않는다.
    private BooleanExpression tagSlugIn(List<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            return null;
        }
        QRecipeTag recipeTag = QRecipeTag.recipeTag;
        return QRecipe.recipe.id.in(
                JPAExpressions.select(recipeTag.recipe.id)
                        .from(recipeTag)
                        .where(recipeTag.tag.slug.in(slugs))
        );
    }

    private BooleanExpression authorEq(Long authorId) {
        return (authorId != null) ? QRecipe.recipe.author.id.eq(authorId) : null;
    }

    private BooleanExpression favoritedBy(Long userId) {
        if (userId == null) {
            return null;
        }
        QRecipeFavorite favorite = QRecipeFavorite.recipeFavorite;
        return JPAExpressions.selectOne()
                .from(favorite)
                .where(favorite.recipe.id.eq(QRecipe.recipe.id), favorite.user.id.eq(userId))
                .exists();
    }

    private BooleanExpression inShoppingCartOf(Long userId) {
        if (userId == null) {
            return null;
        }
        QShoppingCartItem cartItem = QShoppingCartItem.shoppingCartItem;
        return JPAExpressions.selectOne()
                .from(cartItem)
                .where(cartItem.recipe.id.eq(QRecipe.recipe.id), cartItem.user.id.eq(userId))
                .exists();
    }
}
