package com.jdc.recipe_share.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "요청한 사용자가 존재하지 않습니다."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "102", "이미 사용 중인 이메일입니다."),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "103", "이미 사용 중인 사용자 이름입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "104", "인증이 필요합니다."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "105", "현재 비밀번호가 올바르지 않습니다."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "레시피 작성자만 수정하거나 삭제할 수 있습니다."),
    INVALID_RECIPE_IMAGE(HttpStatus.BAD_REQUEST, "203", "이미지 형식이 올바르지 않습니다."),
    RECIPE_IMAGE_REQUIRED(HttpStatus.BAD_REQUEST, "204", "레시피 이미지는 필수입니다."),
    IMAGE_STORE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "205", "이미지를 저장하지 못했습니다."),

    // --- Favorite / Shopping cart (300) ---
    ALREADY_FAVORITED_RECIPE(HttpStatus.BAD_REQUEST, "301", "이미 즐겨찾기에 추가된 레시피입니다. 두 번 추가할 수 없습니다."),
    FAVORITE_NOT_FOUND(HttpStatus.BAD_REQUEST, "302", "즐겨찾기에 없는 레시피입니다."),
    ALREADY_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "303", "이미 장바구니에 있는 레시피입니다. 두 번 추가할 수 없습니다."),
    SHOPPING_CART_ITEM_NOT_FOUND(HttpStatus.BAD_REQUEST, "304", "장바구니에 없는 레시피입니다."),

    // --- Ingredient / Tag (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 재료가 존재하지 않습니다."),
    INVALID_INGREDIENT_AMOUNT(HttpStatus.BAD_REQUEST, "402", "재료의 양은 1 이상이어야 합니다."),
    DUPLICATE_INGREDIENT(HttpStatus.BAD_REQUEST, "403", "재료는 중복될 수 없습니다."),
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "404", "요청한 태그가 존재하지 않습니다."),
    INVALID_TAG(HttpStatus.BAD_REQUEST, "405", "존재하지 않는 태그입니다."),
    DUPLICATE_TAG(HttpStatus.BAD_REQUEST, "406", "태그는 중복될 수 없습니다."),

    // --- Follow (500) ---
    CANNOT_FOLLOW_SELF(HttpStatus.BAD_REQUEST, "501", "자기 자신을 구독할 수 없습니다."),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST, "502", "이미 구독 중인 작성자입니다."),
    NOT_SUBSCRIBED(HttpStatus.BAD_REQUEST, "503", "구독하지 않은 작성자입니다."),
    INVALID_RECIPES_LIMIT(HttpStatus.BAD_REQUEST, "504", "recipes_limit 는 1 이상의 정수여야 합니다."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.BAD_REQUEST, "904", "데이터베이스 제약조건 위반입니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "905", "지원하지 않는 Content-Type 입니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
