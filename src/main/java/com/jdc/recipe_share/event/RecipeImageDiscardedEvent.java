package com.jdc.recipe_share.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 레시피가 더 이상 참조하지 않는 이미지. 커밋된 뒤에 파일을 지운다.
 */
@RequiredArgsConstructor
@Getter
public class RecipeImageDiscardedEvent {
    private final String image;
}
