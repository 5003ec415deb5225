package com.jdc.recipe_share.domain.dto.recipe;

import com.jdc.recipe_share.domain.dto.tag.TagDto;
import com.jdc.recipe_share.domain.dto.user.UserDto;
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
@Schema(description = "레시피 상세 정보 DTO")
public class RecipeDetailDto {

    private Long id;
    private List<TagDto> tags;
    private UserDto author;
    private List<RecipeIngredientDto> ingredients;

    @Schema(description = "현재 사용자의 즐겨찾기 여부 (비로그인은 false)")
    private Boolean isFavorited;

    @Schema(description = "현재 사용자의 장바구니 포함 여부 (비로그인은 false)")
    private Boolean isInShoppingCart;

    private String name;
    private String image;
    private String text;
    private Integer cookingTime;
}
