package com.muzee.profile.mapper;

import com.muzee.profile.domain.UserProfile;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserProfileMapper {

    UserProfile findByUserId(@Param("userId") Long userId);

    boolean existsByUserId(@Param("userId") Long userId);

    boolean existsByUsername(@Param("username") String username);

    boolean existsByUsernameExceptUserId(@Param("username") String username, @Param("userId") Long userId);

    void insert(UserProfile profile);

    /**
     * 仅更新非空字段。
     */
    void updateProfile(UserProfile profile);
}
