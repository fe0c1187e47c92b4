package com.skillswap.common.encryption.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-local {@link KeyStore}. Used when no Redis connection is configured and in tests.
 * Nothing survives a restart.
 */
public class InMemoryKeyStore implements KeyStore {

    private final Clock clock;
    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Instant> expirations = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new ConcurrentHashMap<>();
    private final Map<String, LinkedList<String>> lists = new ConcurrentHashMap<>();

    public InMemoryKeyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        evictIfExpired(key);
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
        expirations.remove(key);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        values.put(key, value);
        expirations.put(key, clock.instant().plus(ttl));
    }

    @Override
    public boolean delete(String key) {
        expirations.remove(key);
        boolean removed = values.remove(key) != null;
        removed |= sets.remove(key) != null;
        removed |= sortedSets.remove(key) != null;
        removed |= lists.remove(key) != null;
        return removed;
    }

    @Override
    public void addToSet(String key, String member) {
        sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(member);
    }

    @Override
    public void removeFromSet(String key, String member) {
        Set<String> members = sets.get(key);
        if (members != null) {
            members.remove(member);
        }
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<String> members = sets.get(key);
        return members == null ? Collections.emptySet() : new LinkedHashSet<>(members);
    }

    @Override
    public void addToSortedSet(String key, String member, double score) {
        sortedSets.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(member, score);
    }

    @Override
    public void removeFromSortedSet(String key, String member) {
        Map<String, Double> scores = sortedSets.get(key);
        if (scores != null) {
            scores.remove(member);
        }
    }

    @Override
    public Set<String> rangeByScore(String key, double min, double max) {
        Map<String, Double> scores = sortedSets.get(key);
        if (scores == null) {
            return Collections.emptySet();
        }
        return scores.entrySet().stream()
            .filter(e -> e.getValue() >= min && e.getValue() <= max)
            .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public void appendToList(String key, String value, Duration retention) {
        evictIfExpired(key);
        LinkedList<String> list = lists.computeIfAbsent(key, k -> new LinkedList<>());
        synchronized (list) {
            list.addFirst(value);
        }
        expirations.put(key, clock.instant().plus(retention));
    }

    @Override
    public List<String> listRange(String key, long start, long end) {
        evictIfExpired(key);
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return Collections.emptyList();
        }
        synchronized (list) {
            int size = list.size();
            int from = (int) Math.max(0, start < 0 ? size + start : start);
            int to = (int) Math.min(size - 1, end < 0 ? size + end : end);
            if (from > to) {
                return Collections.emptyList();
            }
            return new ArrayList<>(list.subList(from, to + 1));
        }
    }

    private void evictIfExpired(String key) {
        Instant expiresAt = expirations.get(key);
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            delete(key);
        }
    }
}
