package com.jdc.recipe_share.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 레시피 이미지 파일을 새로 썼을 때 발행된다. 트랜잭션이 롤백되면 파일을 지운다.
 */
@RequiredArgsConstructor
@Getter
public class RecipeImageStoredEvent {
    private final String image;
}
