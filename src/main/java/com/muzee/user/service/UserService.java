package com.muzee.user.service;

import com.muzee.user.domain.User;

import java.util.Optional;

/**
 * 用户领域服务接口。
 * <p>
 * 邮箱参数均要求已标准化（去空格、小写）。
 */
public interface UserService {

    Optional<User> findByEmail(String email);

    Optional<User> findById(long id);

    boolean existsByEmail(String email);

    User createUser(User user);
}
