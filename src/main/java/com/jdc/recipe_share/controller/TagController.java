package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.tag.TagDto;
import com.jdc.recipe_share.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tags")
@RequiredArgsConstructor
@Tag(name = "태그 API", description = "레시피 태그 조회 API입니다.")
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "태그 목록 조회")
    public ResponseEntity<List<TagDto>> getTags() {
        return ResponseEntity.ok(tagService.findAll());
    }

    @GetMapping("/{id}")
    @Operation(summary = "태그 단건 조회")
    public ResponseEntity<TagDto> getTag(@Parameter(description = "태그 ID") @PathVariable Long id) {
        return ResponseEntity.ok(tagService.findById(id));
    }
}
