package com.muzee.profile.api;

import com.muzee.auth.token.JwtService;
import com.muzee.profile.api.dto.*;
import com.muzee.profile.service.ProfileService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1")
@Validated
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;
    private final JwtService jwtService;

    @PostMapping("/me/profile")
    public ResponseEntity<CreateProfileResponse> create(@AuthenticationPrincipal Jwt jwt,
                                                        @Valid @RequestBody CreateProfileRequest request) {
        long userId = jwtService.extractUserId(jwt);
        ProfileResponse profile = profileService.createProfile(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreateProfileResponse("个人资料已创建", profile));
    }

    @GetMapping("/me/profile")
    public ProfileResponse get(@AuthenticationPrincipal Jwt jwt) {
        return profileService.getProfile(jwtService.extractUserId(jwt));
    }

    @PatchMapping("/me/profile")
    public ProfileResponse patch(@AuthenticationPrincipal Jwt jwt,
                                 @Valid @RequestBody ProfilePatchRequest request) {
        long userId = jwtService.extractUserId(jwt);
        return profileService.updateProfile(userId, request);
    }

    /**
     * 查询用户名是否可用，无需登录。
     *
     * @param username 待查询的用户名。
     * @return 是否可用。
     */
    @GetMapping("/user-profiles/check-username")
    public UsernameAvailabilityResponse checkUsername(
            @RequestParam @NotBlank(message = "必填项") @Size(max = 50, message = "不能超过50个字符") String username) {
        return new UsernameAvailabilityResponse(profileService.isUsernameAvailable(username));
    }
}
