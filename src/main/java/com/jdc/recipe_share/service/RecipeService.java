package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.RecipeSearchCondition;
import com.jdc.recipe_share.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_share.domain.dto.recipe.RecipeStatusDto;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.RecipeIngredient;
import com.jdc.recipe_share.domain.entity.RecipeTag;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_share.domain.repository.RecipeRepository;
import com.jdc.recipe_share.domain.repository.RecipeTagRepository;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.RecipeIngredientMapper;
import com.jdc.recipe_share.mapper.RecipeMapper;
import com.jdc.recipe_share.mapper.TagMapper;
import com.jdc.recipe_share.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final RecipeTagRepository recipeTagRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;
    private final UserRepository userRepository;

    private final RecipeIngredientService recipeIngredientService;
    private final RecipeTagService recipeTagService;
    private final RecipeFavoriteService recipeFavoriteService;
    private final ShoppingCartService shoppingCartService;
    private final RecipeStatusService recipeStatusService;
    private final RecipeImageService recipeImageService;
    private final FollowService followService;

    @Transactional(readOnly = true)
    public Page<RecipeDetailDto> searchRecipes(RecipeSearchCondition condition, Long currentUserId, Pageable pageable) {
        Page<Recipe> page = recipeRepository.search(condition, currentUserId, pageable);
        Map<Long, RecipeDetailDto> details = toDetails(page.getContent(), currentUserId).stream()
                .collect(Collectors.toMap(RecipeDetailDto::getId, d -> d));
        return page.map(recipe -> details.get(recipe.getId()));
    }

    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipeDetail(Long recipeId, Long currentUserId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        return toDetails(List.of(recipe), currentUserId).get(0);
    }

    @Transactional
    public RecipeDetailDto createRecipe(RecipeCreateRequestDto dto, Long userId) {
        return createRecipe(dto, userId, () -> recipeImageService.resolve(dto.getImage()));
    }

    // multipart 업로드: image 파트가 JSON 의 image 값보다 우선
    @Transactional
    public RecipeDetailDto createRecipe(RecipeCreateRequestDto dto, Long userId, MultipartFile image) {
        if (image == null || image.isEmpty()) {
            return createRecipe(dto, userId);
        }
        return createRecipe(dto, userId, () -> recipeImageService.store(image));
    }

    private RecipeDetailDto createRecipe(RecipeCreateRequestDto dto, Long userId, Supplier<String> imageSupplier) {
        User author = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        Recipe recipe = recipeRepository.save(RecipeMapper.toEntity(dto, author, null));
        recipeIngredientService.saveAll(recipe, dto.getIngredients());
        recipeTagService.saveAll(recipe, dto.getTags());

        // 검증이 모두 끝난 뒤 파일을 쓴다
        recipe.updateImage(imageSupplier.get());

        log.info("레시피 생성 - recipeId: {}, authorId: {}", recipe.getId(), userId);
        return toDetails(List.of(recipe), userId).get(0);
    }

    /**
     * 이름/설명/조리시간을 갱신하고 재료, 태그는 요청 값으로 전체 교체한다.
     * image 가 없으면 기존 이미지를 유지한다.
     */
    @Transactional
    public RecipeDetailDto updateRecipe(Long recipeId, RecipeCreateRequestDto dto, Long userId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);

        String oldImage = recipe.getImage();
        recipe.update(dto.getName(), dto.getText(), dto.getCookingTime());

        recipeIngredientService.replaceIngredients(recipe, dto.getIngredients());
        recipeTagService.replaceTags(recipe, dto.getTags());

        // 위 벌크 삭제로 영속성 컨텍스트가 비워지므로 다시 조회한다
        Recipe updated = getRecipeOrThrow(recipeId);
        if (StringUtils.hasText(dto.getImage())) {
            String newImage = recipeImageService.resolve(dto.getImage());
            if (!newImage.equals(oldImage)) {
                updated.updateImage(newImage);
                recipeImageService.discard(oldImage);
            }
        }

        log.info("레시피 수정 - recipeId: {}, userId: {}", recipeId, userId);
        return toDetails(List.of(updated), userId).get(0);
    }

    @Transactional
    public Long deleteRecipe(Long recipeId, Long userId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);
        String image = recipe.getImage();

        recipeFavoriteService.deleteByRecipeId(recipeId);

        shoppingCartService.deleteByRecipeId(recipeId);

        recipeIngredientService.deleteAllByRecipeId(recipeId);

        recipeTagService.deleteAllByRecipeId(recipeId);

        recipeRepository.deleteById(recipeId);

        recipeImageService.discard(image);

        log.info("레시피 삭제 - recipeId: {}, userId: {}", recipeId, userId);
        return recipeId;
    }

    private Recipe getRecipeOrThrow(Long recipeId) {
        return recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    private void validateOwnership(Recipe recipe, Long userId) {
        if (!recipe.isAuthor(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
    }

    /**
     * 레시피 목록을 상세 응답으로 변환한다. 태그/재료/상태/구독 여부는 목록 단위로 한 번씩 조회.
     */
    private List<RecipeDetailDto> toDetails(List<Recipe> recipes, Long currentUserId) {
        if (recipes.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> recipeIds = recipes.stream().map(Recipe::getId).toList();

        Map<Long, List<RecipeTag>> tagsByRecipe = recipeTagRepository.findByRecipeIdIn(recipeIds).stream()
                .collect(Collectors.groupingBy(rt -> rt.getRecipe().getId()));
        Map<Long, List<RecipeIngredient>> ingredientsByRecipe = recipeIngredientRepository.findByRecipeIdIn(recipeIds).stream()
                .collect(Collectors.groupingBy(ri -> ri.getRecipe().getId()));
        Map<Long, RecipeStatusDto> statuses = recipeStatusService.getStatuses(recipeIds, currentUserId);

        Set<Long> authorIds = recipes.stream()
                .map(r -> r.getAuthor().getId())
                .filter(id -> !id.equals(currentUserId))
                .collect(Collectors.toSet());
        Set<Long> subscribedAuthorIds = followService.findSubscribedAuthorIds(currentUserId, authorIds);

        List<RecipeDetailDto> result = new ArrayList<>(recipes.size());
        for (Recipe recipe : recipes) {
            RecipeStatusDto status = statuses.getOrDefault(recipe.getId(), RecipeStatusDto.none());
            User author = recipe.getAuthor();
            result.add(RecipeMapper.toDetailDto(
                    recipe,
                    TagMapper.toDtoList(tagsByRecipe.getOrDefault(recipe.getId(), List.of())),
                    UserMapper.toDto(author, subscribedAuthorIds.contains(author.getId())),
                    RecipeIngredientMapper.toDtoList(ingredientsByRecipe.getOrDefault(recipe.getId(), List.of())),
                    status.isFavorited(),
                    status.isInShoppingCart()
            ));
        }
        return result;
    }
}
