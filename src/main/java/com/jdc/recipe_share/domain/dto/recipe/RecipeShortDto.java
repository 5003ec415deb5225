package com.jdc.recipe_share.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "레시피 간략 정보 DTO")
public class RecipeShortDto {

    @Schema(description = "레시피 ID")
    private Long id;

    @Schema(description = "레시피 이름")
    private String name;

    @Schema(description = "레시피 대표 이미지 경로")
    private String image;

    @Schema(description = "조리 시간 (분 단위)")
    private Integer cookingTime;
}
