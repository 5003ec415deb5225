package com.jdc.recipe_share.domain.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSearchCondition {

    private static final String ENABLED = "1";

    @Schema(description = "태그 slug 목록 (OR 조건)", example = "breakfast,lunch")
    private List<String> tags;

    @Schema(description = "작성자 ID")
    private Long author;

    @Schema(description = "1 이면 내 즐겨찾기만", example = "1")
    private String isFavorited;

    @Schema(description = "1 이면 내 장바구니만", example = "1")
    private String isInShoppingCart;

    public boolean isFavoritedOnly() {
        return ENABLED.equals(isFavorited);
    }

    public boolean isInShoppingCartOnly() {
        return ENABLED.equals(isInShoppingCart);
    }
}
