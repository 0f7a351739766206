package com.muzee.user.service.impl;

import com.muzee.user.domain.User;
import com.muzee.user.mapper.UserMapper;
import com.muzee.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserMapper userMapper;

    /**
     * 根据邮箱查询用户。
     *
     * @param email 标准化后的邮箱地址。
     * @return 用户 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(userMapper.findByEmail(email));
    }

    /**
     * 根据 ID 查询用户。
     *
     * @param id 用户 ID。
     * @return 用户 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    /**
     * 判断邮箱是否已注册。
     *
     * @param email 标准化后的邮箱地址。
     * @return 是否存在。
     */
    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return userMapper.existsByEmail(email);
    }

    /**
     * 创建用户，写入创建与更新时间并持久化，回填自增 ID。
     *
     * @param user 待创建的用户实体。
     * @return 持久化后的用户实体。
     */
    @Override
    @Transactional
    public User createUser(User user) {
        Instant now = Instant.now();
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userMapper.insert(user);
        return user;
    }
}
