package com.muzee.profile.api;

import com.muzee.auth.api.GlobalExceptionHandler;
import com.muzee.auth.config.SecurityConfig;
import com.muzee.auth.exception.BusinessException;
import com.muzee.auth.exception.ErrorCode;
import com.muzee.auth.token.JwtService;
import com.muzee.profile.api.dto.ProfileResponse;
import com.muzee.profile.service.ProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ProfileController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class})
class ProfileControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean ProfileService profileService;
    @MockitoBean JwtService jwtService;
    @MockitoBean JwtDecoder jwtDecoder;

    private static ProfileResponse profile() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        return new ProfileResponse(1L, 7L, "Alice", "alice", null, now, now);
    }

    @Test
    void create_returnsCreatedProfile() throws Exception {
        when(jwtService.extractUserId(any())).thenReturn(7L);
        when(profileService.createProfile(eq(7L), any())).thenReturn(profile());

        mvc.perform(post("/v1/me/profile").with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Alice", "username": "alice"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user_profile.username").value("alice"))
                .andExpect(jsonPath("$.user_profile.user_id").value(7));
    }

    @Test
    void get_missingProfileIsNotFound() throws Exception {
        when(jwtService.extractUserId(any())).thenReturn(7L);
        when(profileService.getProfile(7L)).thenThrow(new BusinessException(ErrorCode.PROFILE_NOT_FOUND));

        mvc.perform(get("/v1/me/profile").with(jwt()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("profile_not_found"));
    }

    @Test
    void patch_usernameTakenIsConflict() throws Exception {
        when(jwtService.extractUserId(any())).thenReturn(7L);
        when(profileService.updateProfile(eq(7L), any())).thenThrow(new BusinessException(ErrorCode.USERNAME_TAKEN));

        mvc.perform(patch("/v1/me/profile").with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username": "bob"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("username_taken"));
    }

    @Test
    void patch_whitespaceOnlyValuesAreRejected() throws Exception {
        when(jwtService.extractUserId(any())).thenReturn(7L);

        mvc.perform(patch("/v1/me/profile").with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "   ", "username": "\\t\\n"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.details[?(@.field == 'name')].message").value("不能为空白"))
                .andExpect(jsonPath("$.details[?(@.field == 'username')]").exists());

        verify(profileService, never()).updateProfile(anyLong(), any());
    }

    @Test
    void patch_valueWithSurroundingSpacesIsAccepted() throws Exception {
        when(jwtService.extractUserId(any())).thenReturn(7L);
        when(profileService.updateProfile(eq(7L), any())).thenReturn(profile());

        mvc.perform(patch("/v1/me/profile").with(jwt())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "  Alice  "}
                                """))
                .andExpect(status().isOk());
    }

    @Test
    void profileRequiresAuthentication() throws Exception {
        mvc.perform(get("/v1/me/profile"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void checkUsername_isPublic() throws Exception {
        when(profileService.isUsernameAvailable("alice")).thenReturn(true);

        mvc.perform(get("/v1/user-profiles/check-username").param("username", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void checkUsername_requiresParameter() throws Exception {
        mvc.perform(get("/v1/user-profiles/check-username"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
    }
}
