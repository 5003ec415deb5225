package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_share.service.IngredientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ingredients")
@RequiredArgsConstructor
@Tag(name = "재료 API", description = "재료 조회 API입니다.")
public class IngredientController {

    private final IngredientService ingredientService;

    @GetMapping
    @Operation(summary = "재료 목록 조회", description = "name 으로 시작하는 재료를 이름순으로 조회합니다. (대소문자 무시)")
    public ResponseEntity<List<IngredientDto>> getIngredients(
            @Parameter(description = "재료 이름 접두어", example = "flo")
            @RequestParam(required = false) String name
    ) {
        return ResponseEntity.ok(ingredientService.findAll(name));
    }

    @GetMapping("/{id}")
    @Operation(summary = "재료 단건 조회")
    public ResponseEntity<IngredientDto> getIngredient(
            @Parameter(description = "재료 ID") @PathVariable Long id
    ) {
        return ResponseEntity.ok(ingredientService.findById(id));
    }
}
