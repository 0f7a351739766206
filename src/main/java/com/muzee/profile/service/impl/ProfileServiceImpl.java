package com.muzee.profile.service.impl;

import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import com.muzee.profile.api.dto.CreateProfileRequest;
import com.muzee.profile.api.dto.ProfilePatchRequest;
import com.muzee.profile.api.dto.ProfileResponse;
import com.muzee.profile.domain.UserProfile;
import com.muzee.profile.mapper.UserProfileMapper;
import com.muzee.profile.service.ProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
@RequiredArgsConstructor
public class ProfileServiceImpl implements ProfileService {

    private final UserProfileMapper profileMapper;
    private final Clock clock;

    @Override
    @Transactional
    public ProfileResponse createProfile(long userId, CreateProfileRequest request) {
        if (profileMapper.existsByUserId(userId)) {
            throw new BusinessException(ErrorCode.PROFILE_ALREADY_EXISTS);
        }
        String username = request.username().trim();
        if (profileMapper.existsByUsername(username)) {
            throw new BusinessException(ErrorCode.USERNAME_TAKEN);
        }

        Instant now = Instant.now(clock);
        UserProfile profile = UserProfile.builder()
                .userId(userId)
                .name(request.name().trim())
                .username(username)
                .iconPath(request.iconPath())
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            profileMapper.insert(profile);
        } catch (DuplicateKeyException ex) {
            // 并发创建时由唯一索引兜底
            throw new BusinessException(ErrorCode.USERNAME_TAKEN);
        }
        return toResponse(profile);
    }

    @Override
    @Transactional(readOnly = true)
    public ProfileResponse getProfile(long userId) {
        return toResponse(requireProfile(userId));
    }

    @Override
    @Transactional
    public ProfileResponse updateProfile(long userId, ProfilePatchRequest request) {
        if (request.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "未提交任何更新字段");
        }
        UserProfile current = requireProfile(userId);

        UserProfile patch = new UserProfile();
        patch.setUserId(current.getUserId());
        if (request.name() != null) {
            patch.setName(request.name().trim());
        }
        if (request.username() != null) {
            String username = request.username().trim();
            if (profileMapper.existsByUsernameExceptUserId(username, userId)) {
                throw new BusinessException(ErrorCode.USERNAME_TAKEN);
            }
            patch.setUsername(username);
        }
        if (request.iconPath() != null) {
            patch.setIconPath(request.iconPath());
        }
        patch.setUpdatedAt(Instant.now(clock));

        try {
            profileMapper.updateProfile(patch);
        } catch (DuplicateKeyException ex) {
            throw new BusinessException(ErrorCode.USERNAME_TAKEN);
        }
        return toResponse(profileMapper.findByUserId(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isUsernameAvailable(String username) {
        return !profileMapper.existsByUsername(username.trim());
    }

    private UserProfile requireProfile(long userId) {
        UserProfile profile = profileMapper.findByUserId(userId);
        if (profile == null) {
            throw new BusinessException(ErrorCode.PROFILE_NOT_FOUND);
        }
        return profile;
    }

    private ProfileResponse toResponse(UserProfile profile) {
        return new ProfileResponse(
                profile.getId(),
                profile.getUserId(),
                profile.getName(),
                profile.getUsername(),
                profile.getIconPath(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }
}
