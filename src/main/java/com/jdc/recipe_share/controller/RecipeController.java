package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.RecipeSearchCondition;
import com.jdc.recipe_share.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.security.CustomUserDetails;
import com.jdc.recipe_share.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.PagedModel;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "레시피 API", description = "레시피 목록/상세 조회, 생성, 수정, 삭제 API입니다.")
public class RecipeController {

    private final RecipeService recipeService;

    @GetMapping
    @Operation(summary = "레시피 목록 조회",
            description = "최신순으로 레시피를 조회합니다. tags(slug, OR 조건), author, is_favorited=1, is_in_shopping_cart=1 로 필터링할 수 있습니다.")
    public ResponseEntity<PagedModel<RecipeDetailDto>> getRecipes(
            @Parameter(description = "태그 slug 목록", example = "breakfast,lunch")
            @RequestParam(required = false) List<String> tags,
            @Parameter(description = "작성자 ID")
            @RequestParam(required = false) Long author,
            @Parameter(description = "1 이면 즐겨찾기한 레시피만", example = "1")
            @RequestParam(name = "is_favorited", required = false) String isFavorited,
            @Parameter(description = "1 이면 장바구니에 담긴 레시피만", example = "1")
            @RequestParam(name = "is_in_shopping_cart", required = false) String isInShoppingCart,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeSearchCondition condition = RecipeSearchCondition.builder()
                .tags(tags)
                .author(author)
                .isFavorited(isFavorited)
                .isInShoppingCart(isInShoppingCart)
                .build();

        Page<RecipeDetailDto> page = recipeService.searchRecipes(condition, currentUserId(userDetails), pageable);
        return ResponseEntity.ok(new PagedModel<>(page));
    }

    @GetMapping("/{id}")
    @Operation(summary = "레시피 상세 조회", description = "레시피의 태그, 재료, 작성자, 즐겨찾기/장바구니 여부를 함께 반환합니다.")
    public ResponseEntity<RecipeDetailDto> getRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(recipeService.getRecipeDetail(id, currentUserId(userDetails)));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "레시피 생성", description = "image 는 data:image/...;base64, 형식의 문자열입니다.")
    public ResponseEntity<RecipeDetailDto> createRecipe(
            @Valid @RequestBody RecipeCreateRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeDetailDto created = recipeService.createRecipe(request, requireUserId(userDetails));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "레시피 생성 (파일 업로드)", description = "recipe 파트(JSON)와 image 파트(파일)로 레시피를 생성합니다.")
    public ResponseEntity<RecipeDetailDto> createRecipeWithFile(
            @Valid @RequestPart("recipe") RecipeCreateRequestDto request,
            @RequestPart(value = "image", required = false) MultipartFile image,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        RecipeDetailDto created = recipeService.createRecipe(request, requireUserId(userDetails), image);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PatchMapping("/{id}")
    @Operation(summary = "레시피 수정", description = "작성자만 수정할 수 있습니다. 재료와 태그는 전체 교체되며, image 를 생략하면 기존 이미지를 유지합니다.")
    public ResponseEntity<RecipeDetailDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @Valid @RequestBody RecipeCreateRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(recipeService.updateRecipe(id, request, requireUserId(userDetails)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "레시피 삭제", description = "작성자만 삭제할 수 있습니다.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        recipeService.deleteRecipe(id, requireUserId(userDetails));
        return ResponseEntity.noContent().build();
    }

    private Long currentUserId(CustomUserDetails userDetails) {
        return userDetails != null ? userDetails.getUserId() : null;
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
