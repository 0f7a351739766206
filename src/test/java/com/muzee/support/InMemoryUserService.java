package com.muzee.support;

import com.muzee.user.domain.User;
import com.muzee.user.service.UserService;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版用户服务，邮箱唯一约束与数据库一致。
 */
public class InMemoryUserService implements UserService {

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<User> findByEmail(String email) {
        return users.values().stream().filter(user -> user.getEmail().equals(email)).findFirst();
    }

    @Override
    public Optional<User> findById(long id) {
        return Optional.ofNullable(users.get(id));
    }

    @Override
    public boolean existsByEmail(String email) {
        return findByEmail(email).isPresent();
    }

    @Override
    public synchronized User createUser(User user) {
        if (existsByEmail(user.getEmail())) {
            throw new DuplicateKeyException("Duplicate entry for key 'uk_users_email'");
        }
        Instant now = Instant.now();
        user.setId(sequence.incrementAndGet());
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        users.put(user.getId(), user);
        return user;
    }

    public void remove(long id) {
        users.remove(id);
    }

    public int count() {
        return users.size();
    }
}
