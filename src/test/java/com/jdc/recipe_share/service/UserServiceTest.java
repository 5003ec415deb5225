package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.user.SetPasswordRequestDto;
import com.jdc.recipe_share.domain.dto.user.UserCreateRequestDto;
import com.jdc.recipe_share.domain.dto.user.UserCreateResponseDto;
import com.jdc.recipe_share.domain.dto.user.UserDto;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private FollowService followService;
    @Mock
    private PasswordEncoder passwordEncoder;

    @InjectMocks
    private UserService userService;

    private UserCreateRequestDto signUp() {
        return UserCreateRequestDto.builder()
                .email("cook@example.com")
                .username("cook")
                .firstName("Kim")
                .lastName("Cook")
                .password("password123")
                .build();
    }

    @Test
    @DisplayName("createUser: 비밀번호를 해시해서 저장하고 응답에는 비밀번호가 없다")
    void createUser_hashesPassword() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(false);
        when(passwordEncoder.encode("password123")).thenReturn("{bcrypt}hashed");

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        when(userRepository.save(captor.capture())).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            return User.builder().id(7L).email(u.getEmail()).username(u.getUsername())
                    .firstName(u.getFirstName()).lastName(u.getLastName()).password(u.getPassword()).build();
        });

        UserCreateResponseDto response = userService.createUser(signUp());

        assertThat(captor.getValue().getPassword()).isEqualTo("{bcrypt}hashed");
        assertThat(response.getId()).isEqualTo(7L);
        assertThat(response.getUsername()).isEqualTo("cook");
    }

    @Test
    @DisplayName("createUser: 이메일이 중복되면 DUPLICATE_EMAIL")
    void createUser_duplicateEmail() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> userService.createUser(signUp()));

        assertEquals(ErrorCode.DUPLICATE_EMAIL, ex.getErrorCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("createUser: 사용자 이름이 중복되면 DUPLICATE_USERNAME")
    void createUser_duplicateUsername() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> userService.createUser(signUp()));

        assertEquals(ErrorCode.DUPLICATE_USERNAME, ex.getErrorCode());
    }

    @Test
    @DisplayName("getUser: 구독 여부를 함께 반환한다")
    void getUser_includesSubscription() {
        when(userRepository.findById(2L)).thenReturn(Optional.of(User.builder().id(2L).username("chef").build()));
        when(followService.isSubscribed(1L, 2L)).thenReturn(true);

        UserDto dto = userService.getUser(1L, 2L);

        assertThat(dto.getIsSubscribed()).isTrue();
        assertThat(dto.getUsername()).isEqualTo("chef");
    }

    @Test
    @DisplayName("setPassword: 현재 비밀번호가 틀리면 INVALID_CURRENT_PASSWORD")
    void setPassword_wrongCurrent() {
        User user = User.builder().id(1L).password("{bcrypt}old").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "{bcrypt}old")).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class, () ->
                userService.setPassword(1L, new SetPasswordRequestDto("newPassword1", "wrong")));

        assertEquals(ErrorCode.INVALID_CURRENT_PASSWORD, ex.getErrorCode());
        assertThat(user.getPassword()).isEqualTo("{bcrypt}old");
    }

    @Test
    @DisplayName("setPassword: 현재 비밀번호가 맞으면 새 비밀번호로 변경된다")
    void setPassword_changes() {
        User user = User.builder().id(1L).password("{bcrypt}old").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("oldPassword", "{bcrypt}old")).thenReturn(true);
        when(passwordEncoder.encode("newPassword1")).thenReturn("{bcrypt}new");

        userService.setPassword(1L, new SetPasswordRequestDto("newPassword1", "oldPassword"));

        assertThat(user.getPassword()).isEqualTo("{bcrypt}new");
    }
}
