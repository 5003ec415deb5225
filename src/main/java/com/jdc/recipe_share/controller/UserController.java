package com.jdc.recipe_share.controller;

import com.jdc.recipe_share.domain.dto.user.*;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.security.CustomUserDetails;
import com.jdc.recipe_share.service.FollowService;
import com.jdc.recipe_share.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.PagedModel;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "사용자 API", description = "회원가입, 사용자 조회, 비밀번호 변경, 구독 API입니다.")
public class UserController {

    private final UserService userService;
    private final FollowService followService;

    @GetMapping
    @Operation(summary = "사용자 목록 조회", description = "ID 순으로 사용자 목록을 조회합니다.")
    public ResponseEntity<PagedModel<UserDto>> getUsers(
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        Long currentUserId = userDetails != null ? userDetails.getUserId() : null;
        return ResponseEntity.ok(new PagedModel<>(userService.getUsers(currentUserId, pageable)));
    }

    @PostMapping
    @Operation(summary = "회원가입", description = "이메일과 사용자 이름은 중복될 수 없습니다.")
    public ResponseEntity<UserCreateResponseDto> createUser(@Valid @RequestBody UserCreateRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.createUser(request));
    }

    @GetMapping("/me")
    @Operation(summary = "내 정보 조회")
    public ResponseEntity<UserDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.getMe(requireUserId(userDetails)));
    }

    @PostMapping("/set_password")
    @Operation(summary = "비밀번호 변경", description = "현재 비밀번호가 일치해야 변경됩니다.")
    public ResponseEntity<Void> setPassword(
            @Valid @RequestBody SetPasswordRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        userService.setPassword(requireUserId(userDetails), request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/subscriptions")
    @Operation(summary = "구독 목록 조회", description = "내가 구독한 작성자와 작성자의 레시피를 조회합니다.")
    public ResponseEntity<PagedModel<SubscriptionDto>> getSubscriptions(
            @Parameter(description = "작성자별 레시피 최대 개수", example = "3")
            @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @ParameterObject @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(new PagedModel<>(
                followService.getSubscriptions(requireUserId(userDetails), recipesLimit, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "사용자 조회")
    public ResponseEntity<UserDto> getUser(
            @Parameter(description = "사용자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        return ResponseEntity.ok(userService.getUser(requireUserId(userDetails), id));
    }

    @PostMapping("/{id}/subscribe")
    @Operation(summary = "작성자 구독", description = "자기 자신이나 이미 구독한 작성자는 구독할 수 없습니다.")
    public ResponseEntity<SubscriptionDto> subscribe(
            @Parameter(description = "작성자 ID") @PathVariable Long id,
            @Parameter(description = "응답에 포함할 레시피 최대 개수", example = "3")
            @RequestParam(name = "recipes_limit", required = false) Integer recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        SubscriptionDto subscription = followService.subscribe(requireUserId(userDetails), id, recipesLimit);
        return ResponseEntity.status(HttpStatus.CREATED).body(subscription);
    }

    @DeleteMapping("/{id}/subscribe")
    @Operation(summary = "구독 취소")
    public ResponseEntity<Void> unsubscribe(
            @Parameter(description = "작성자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails
    ) {
        followService.unsubscribe(requireUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    private Long requireUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
