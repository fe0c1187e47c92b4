package com.skillswap.common.encryption.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract required by the key management and audit services.
 *
 * <p>Each call is atomic on its own. Nothing is transactional across calls.
 */
public interface KeyStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    void addToSet(String key, String member);

    void removeFromSet(String key, String member);

    Set<String> setMembers(String key);

    void addToSortedSet(String key, String member, double score);

    void removeFromSortedSet(String key, String member);

    /**
     * Members whose score lies in {@code [min, max]}, lowest score first.
     */
    Set<String> rangeByScore(String key, double min, double max);

    /**
     * Pushes onto the head of a list and (re)sets the list's retention.
     */
    void appendToList(String key, String value, Duration retention);

    List<String> listRange(String key, long start, long end);
}
