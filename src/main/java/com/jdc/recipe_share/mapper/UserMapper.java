package com.jdc.recipe_share.mapper;

import com.jdc.recipe_share.domain.dto.recipe.RecipeShortDto;
import com.jdc.recipe_share.domain.dto.user.*;
import com.jdc.recipe_share.domain.entity.User;

import java.util.List;

public class UserMapper {

    public static UserDto toDto(User user, boolean subscribed) {
        if (user == null) return null;
        return UserDto.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(subscribed)
                .build();
    }

    // 구독 목록/구독 응답용
    public static SubscriptionDto toSubscriptionDto(User author, boolean subscribed,
                                                    List<RecipeShortDto> recipes, long recipesCount) {
        return SubscriptionDto.builder()
                .id(author.getId())
                .email(author.getEmail())
                .username(author.getUsername())
                .firstName(author.getFirstName())
                .lastName(author.getLastName())
                .isSubscribed(subscribed)
                .recipes(recipes)
                .recipesCount(recipesCount)
                .build();
    }

    public static User toEntity(UserCreateRequestDto dto, String encodedPassword) {
        return User.builder()
                .email(dto.getEmail())
                .username(dto.getUsername())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .password(encodedPassword)
                .build();
    }

    public static UserCreateResponseDto toCreateResponse(User user) {
        return UserCreateResponseDto.builder()
                .id(user.getId())
                .email(user.getEmail())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }
}
