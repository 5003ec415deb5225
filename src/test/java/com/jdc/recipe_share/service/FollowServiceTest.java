package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.user.SubscriptionDto;
import com.jdc.recipe_share.domain.entity.Follow;
import com.jdc.recipe_share.domain.entity.Recipe;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.FollowRepository;
import com.jdc.recipe_share.domain.repository.RecipeRepository;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FollowServiceTest {

    @Mock
    private FollowRepository followRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private RecipeRepository recipeRepository;

    @InjectMocks
    private FollowService followService;

    private User me;
    private User author;

    @BeforeEach
    void setUp() {
        me = User.builder().id(1L).username("me").build();
        author = User.builder().id(2L).username("chef").email("chef@example.com").build();
    }

    @Test
    @DisplayName("subscribe: 자기 자신은 구독할 수 없다")
    void subscribe_self_throws() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(me));

        CustomException ex = assertThrows(CustomException.class, () -> followService.subscribe(1L, 1L, null));

        assertEquals(ErrorCode.CANNOT_FOLLOW_SELF, ex.getErrorCode());
        verify(followRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("subscribe: 이미 구독 중이면 ALREADY_SUBSCRIBED")
    void subscribe_duplicate_throws() {
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));
        when(followRepository.existsByUserIdAndAuthorId(1L, 2L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> followService.subscribe(1L, 2L, null));

        assertEquals(ErrorCode.ALREADY_SUBSCRIBED, ex.getErrorCode());
    }

    @Test
    @DisplayName("subscribe: 없는 사용자면 USER_NOT_FOUND")
    void subscribe_unknownAuthor_throws() {
        when(userRepository.findById(9L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> followService.subscribe(1L, 9L, null));

        assertEquals(ErrorCode.USER_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("subscribe: recipes_limit 만큼 최신 레시피와 전체 레시피 수를 함께 반환한다")
    void subscribe_returnsSubscriptionView() {
        Recipe newest = Recipe.builder().id(12L).name("새 레시피").cookingTime(5).build();
        when(userRepository.findById(2L)).thenReturn(Optional.of(author));
        when(userRepository.findById(1L)).thenReturn(Optional.of(me));
        when(followRepository.existsByUserIdAndAuthorId(1L, 2L)).thenReturn(false);
        when(followRepository.saveAndFlush(any(Follow.class))).thenAnswer(inv -> inv.getArgument(0));
        when(recipeRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(2L, PageRequest.of(0, 1)))
                .thenReturn(new PageImpl<>(List.of(newest)));
        when(recipeRepository.countByAuthorId(2L)).thenReturn(3L);

        SubscriptionDto dto = followService.subscribe(1L, 2L, 1);

        assertThat(dto.getId()).isEqualTo(2L);
        assertThat(dto.getIsSubscribed()).isTrue();
        assertThat(dto.getRecipes()).extracting("id").containsExactly(12L);
        assertThat(dto.getRecipesCount()).isEqualTo(3L);
    }

    @Test
    @DisplayName("subscribe/getSubscriptions: recipes_limit 가 0 이하이면 INVALID_RECIPES_LIMIT")
    void recipesLimit_nonPositive_throws() {
        CustomException ex = assertThrows(CustomException.class, () -> followService.subscribe(1L, 2L, 0));
        assertEquals(ErrorCode.INVALID_RECIPES_LIMIT, ex.getErrorCode());

        ex = assertThrows(CustomException.class,
                () -> followService.getSubscriptions(1L, -1, PageRequest.of(0, 6)));
        assertEquals(ErrorCode.INVALID_RECIPES_LIMIT, ex.getErrorCode());
        verifyNoInteractions(followRepository, userRepository, recipeRepository);
    }

    @Test
    @DisplayName("unsubscribe: 구독하지 않았으면 NOT_SUBSCRIBED")
    void unsubscribe_notSubscribed_throws() {
        when(userRepository.existsById(2L)).thenReturn(true);
        when(followRepository.findByUserIdAndAuthorId(1L, 2L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> followService.unsubscribe(1L, 2L));

        assertEquals(ErrorCode.NOT_SUBSCRIBED, ex.getErrorCode());
    }

    @Test
    @DisplayName("getSubscriptions: 작성자별 레시피 수는 한 번의 집계 쿼리로 가져온다")
    void getSubscriptions_batchCounts() {
        Pageable pageable = PageRequest.of(0, 6);
        Page<User> authors = new PageImpl<>(List.of(author), pageable, 1);
        when(followRepository.findAuthorsByUserId(1L, pageable)).thenReturn(authors);
        when(recipeRepository.countMapByAuthorIds(List.of(2L))).thenReturn(Map.of(2L, 4L));
        when(recipeRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(2L)).thenReturn(List.of());

        Page<SubscriptionDto> page = followService.getSubscriptions(1L, null, pageable);

        assertThat(page.getContent()).hasSize(1);
        assertThat(page.getContent().get(0).getRecipesCount()).isEqualTo(4L);
        assertThat(page.getContent().get(0).getIsSubscribed()).isTrue();
    }

    @Test
    @DisplayName("isSubscribed: 비로그인 또는 본인 조회는 false")
    void isSubscribed_anonymousOrSelf() {
        assertThat(followService.isSubscribed(null, 2L)).isFalse();
        assertThat(followService.isSubscribed(2L, 2L)).isFalse();
        assertThat(followService.findSubscribedAuthorIds(null, Set.of(2L))).isEmpty();
        verifyNoInteractions(followRepository);
    }
}
