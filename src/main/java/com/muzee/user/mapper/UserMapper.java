package com.muzee.user.mapper;

import com.muzee.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface UserMapper {

    User findByEmail(@Param("email") String email);

    User findById(@Param("id") Long id);

    boolean existsByEmail(@Param("email") String email);

    void insert(User user);
}
