package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.security.CustomUserDetails;
import com.jdc.recipe_share.service.ShoppingCartService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "장바구니 API", description = "레시피를 장바구니에 담고, 필요한 재료 목록을 내려받습니다.")
public class ShoppingCartController {

    private static final String SHOPPING_LIST_FILENAME = "shopping_list.txt";

    private final ShoppingCartService shoppingCartService;

    @PostMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니에 추가", description = "이미 담긴 레시피면 400 을 반환합니다.")
    public ResponseEntity<RecipeShortDto> addToCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeShortDto recipe = shoppingCartService.addToCart(requireUserId(userDetails), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(recipe);
    }

    @DeleteMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니에서 삭제", description = "담기지 않은 레시피면 400 을 반환합니다.")
    public ResponseEntity<Void> removeFromCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        shoppingCartService.removeFromCart(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/download_shopping_cart")
    @Operation(summary = "장바구니 재료 목록 다운로드",
            description = "장바구니에 담긴 레시피들의 재료를 이름/단위별로 합산한 텍스트 파일을 반환합니다.")
    public ResponseEntity<String> downloadShoppingCart(
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        String body = shoppingCartService.renderShoppingList(requireUserId(userDetails));

        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(SHOPPING_LIST_FILENAME)
                        .build()
                        .toString())
                .body(body);
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
