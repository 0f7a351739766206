package com.muzee.profile.service;

import com.muzee.profile.api.dto.CreateProfileRequest;
import com.muzee.profile.api.dto.ProfilePatchRequest;
import com.muzee.profile.api.dto.ProfileResponse;

/**
 * 个人资料业务接口。
 */
public interface ProfileService {

    ProfileResponse createProfile(long userId, CreateProfileRequest request);

    ProfileResponse getProfile(long userId);

    ProfileResponse updateProfile(long userId, ProfilePatchRequest request);

    boolean isUsernameAvailable(String username);
}
