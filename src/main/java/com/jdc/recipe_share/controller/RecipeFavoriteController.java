package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.security.CustomUserDetails;
import com.jdc.recipe_share.service.RecipeFavoriteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "레시피 즐겨찾기 API", description = "레시피를 즐겨찾기에 추가하거나 삭제합니다.")
public class RecipeFavoriteController {

    private final RecipeFavoriteService favoriteService;

    @PostMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 추가", description = "이미 즐겨찾기한 레시피면 400 을 반환합니다.")
    public ResponseEntity<RecipeShortDto> addFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        RecipeShortDto recipe = favoriteService.addFavorite(userDetails.getUserId(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(recipe);
    }

    @DeleteMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 삭제", description = "즐겨찾기하지 않은 레시피면 400 을 반환합니다.")
    public ResponseEntity<Void> removeFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        favoriteService.removeFavorite(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
