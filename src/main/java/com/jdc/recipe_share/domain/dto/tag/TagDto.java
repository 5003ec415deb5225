package com.jdc.recipe_share.domain.dto.tag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagDto {
    private Long id;
    private String name;
    private String color;   // 예: "#E26C2D"
    private String slug;    // 예: "breakfast"
}
