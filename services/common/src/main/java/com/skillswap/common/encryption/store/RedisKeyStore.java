package com.skillswap.common.encryption.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link KeyStore} backed by Redis strings, sets, sorted sets and lists.
 */
@RequiredArgsConstructor
public class RedisKeyStore implements KeyStore {

    private final StringRedisTemplate redisTemplate;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value) {
        redisTemplate.opsForValue().set(key, value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(key));
    }

    @Override
    public void addToSet(String key, String member) {
        redisTemplate.opsForSet().add(key, member);
    }

    @Override
    public void removeFromSet(String key, String member) {
        redisTemplate.opsForSet().remove(key, member);
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<String> members = redisTemplate.opsForSet().members(key);
        return members == null ? Collections.emptySet() : members;
    }

    @Override
    public void addToSortedSet(String key, String member, double score) {
        redisTemplate.opsForZSet().add(key, member, score);
    }

    @Override
    public void removeFromSortedSet(String key, String member) {
        redisTemplate.opsForZSet().remove(key, member);
    }

    @Override
    public Set<String> rangeByScore(String key, double min, double max) {
        Set<String> members = redisTemplate.opsForZSet().rangeByScore(key, min, max);
        return members == null ? Collections.emptySet() : new LinkedHashSet<>(members);
    }

    @Override
    public void appendToList(String key, String value, Duration retention) {
        redisTemplate.opsForList().leftPush(key, value);
        redisTemplate.expire(key, retention);
    }

    @Override
    public List<String> listRange(String key, long start, long end) {
        List<String> values = redisTemplate.opsForList().range(key, start, end);
        return values == null ? Collections.emptyList() : values;
    }
}
