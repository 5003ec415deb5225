package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.domain.dto.user.SubscriptionDto;
import com.jdc.recipe_share.domain.entity.Follow;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.FollowRepository;
import com.jdc.recipe_share.domain.repository.RecipeRepository;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.RecipeMapper;
import com.jdc.recipe_share.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class FollowService {

    private final FollowRepository followRepository;
    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;

    @Transactional
    public SubscriptionDto subscribe(Long userId, Long authorId, Integer recipesLimit) {
        validateRecipesLimit(recipesLimit);

        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        if (author.getId().equals(userId)) {
            throw new CustomException(ErrorCode.CANNOT_FOLLOW_SELF);
        }
        if (followRepository.existsByUserIdAndAuthorId(userId, authorId)) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            followRepository.saveAndFlush(Follow.builder().user(user).author(author).build());
        } catch (DataIntegrityViolationException e) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED, e);
        }

        log.info("구독 - userId: {}, authorId: {}", userId, authorId);
        return toSubscriptionDto(author, true, recipesLimit);
    }

    @Transactional
    public void unsubscribe(Long userId, Long authorId) {
        if (!userRepository.existsById(authorId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }

        Follow follow = followRepository.findByUserIdAndAuthorId(userId, authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.NOT_SUBSCRIBED));

        followRepository.delete(follow);
        log.info("구독 취소 - userId: {}, authorId: {}", userId, authorId);
    }

    /**
     * 내가 구독한 작성자 목록. 작성자별 레시피는 최신순, recipesLimit 개까지.
     */
    @Transactional(readOnly = true)
    public Page<SubscriptionDto> getSubscriptions(Long userId, Integer recipesLimit, Pageable pageable) {
        validateRecipesLimit(recipesLimit);

        Page<User> authors = followRepository.findAuthorsByUserId(userId, pageable);
        List<Long> authorIds = authors.getContent().stream().map(User::getId).toList();
        Map<Long, Long> recipeCounts = authorIds.isEmpty()
                ? Collections.emptyMap()
                : recipeRepository.countMapByAuthorIds(authorIds);

        return authors.map(author -> UserMapper.toSubscriptionDto(
                author,
                true,
                findRecipes(author.getId(), recipesLimit),
                recipeCounts.getOrDefault(author.getId(), 0L)
        ));
    }

    /**
     * currentUserId 가 구독 중인 작성자 ID. 비로그인이면 빈 Set.
     */
    @Transactional(readOnly = true)
    public Set<Long> findSubscribedAuthorIds(Long currentUserId, Collection<Long> authorIds) {
        if (currentUserId == null || authorIds == null || authorIds.isEmpty()) {
            return Collections.emptySet();
        }
        return followRepository.findAuthorIdsByUserIdAndAuthorIdIn(currentUserId, authorIds);
    }

    @Transactional(readOnly = true)
    public boolean isSubscribed(Long currentUserId, Long authorId) {
        if (currentUserId == null || currentUserId.equals(authorId)) {
            return false;
        }
        return followRepository.existsByUserIdAndAuthorId(currentUserId, authorId);
    }

    private SubscriptionDto toSubscriptionDto(User author, boolean subscribed, Integer recipesLimit) {
        return UserMapper.toSubscriptionDto(
                author,
                subscribed,
                findRecipes(author.getId(), recipesLimit),
                recipeRepository.countByAuthorId(author.getId())
        );
    }

    private List<RecipeShortDto> findRecipes(Long authorId, Integer recipesLimit) {
        List<Recipe> recipes = recipesLimit == null
                ? recipeRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(authorId)
                : recipeRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(authorId, PageRequest.of(0, recipesLimit))
                .getContent();
        return RecipeMapper.toShortDtoList(recipes);
    }

    private void validateRecipesLimit(Integer recipesLimit) {
        if (recipesLimit != null && recipesLimit < 1) {
            throw new CustomException(ErrorCode.INVALID_RECIPES_LIMIT);
        }
    }
}
