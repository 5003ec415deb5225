package com.jdc.recipe_share.service;

import com.jdc.recipe_share.domain.dto.user.SetPasswordRequestDto;
import com.jdc.recipe_share.domain.dto.user.UserCreateRequestDto;
import com.jdc.recipe_share.domain.dto.user.UserCreateResponseDto;
import com.jdc.recipe_share.domain.dto.user.UserDto;
import com.jdc.recipe_share.domain.entity.User;
import com.jdc.recipe_share.domain.repository.UserRepository;
import com.jdc.recipe_share.exception.CustomException;
import com.jdc.recipe_share.exception.ErrorCode;
import com.jdc.recipe_share.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final FollowService followService;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public UserCreateResponseDto createUser(UserCreateRequestDto dto) {
        if (userRepository.existsByEmail(dto.getEmail())) {
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL);
        }
        if (userRepository.existsByUsername(dto.getUsername())) {
            throw new CustomException(ErrorCode.DUPLICATE_USERNAME);
        }

        User user = userRepository.save(UserMapper.toEntity(dto, passwordEncoder.encode(dto.getPassword())));
        log.info("회원가입 - userId: {}, username: {}", user.getId(), user.getUsername());
        return UserMapper.toCreateResponse(user);
    }

    // ID 순 사용자 목록
    @Transactional(readOnly = true)
    public Page<UserDto> getUsers(Long currentUserId, Pageable pageable) {
        Pageable byId = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by(Sort.Direction.ASC, "id"));
        Page<User> users = userRepository.findAll(byId);

        List<Long> ids = users.getContent().stream().map(User::getId).toList();
        Set<Long> subscribedIds = followService.findSubscribedAuthorIds(currentUserId, ids);

        return users.map(user -> UserMapper.toDto(user, subscribedIds.contains(user.getId())));
    }

    @Transactional(readOnly = true)
    public UserDto getUser(Long currentUserId, Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        return UserMapper.toDto(user, followService.isSubscribed(currentUserId, userId));
    }

    @Transactional(readOnly = true)
    public UserDto getMe(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        return UserMapper.toDto(user, false);
    }

    @Transactional
    public void setPassword(Long userId, SetPasswordRequestDto dto) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPassword())) {
            throw new CustomException(ErrorCode.INVALID_CURRENT_PASSWORD);
        }

        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
        log.info("비밀번호 변경 - userId: {}", userId);
    }
}
