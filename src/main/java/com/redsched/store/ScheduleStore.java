package com.redsched.store;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Store client capability used by entries and the scheduler.
 * Covers the hash, sorted-set and set operations the scheduler needs;
 * every method throws {@link ScheduleStoreException} when the store cannot be reached.
 */
public interface ScheduleStore {

    void putField(String key, String field, String value);

    Optional<String> getField(String key, String field);

    boolean exists(String key);

    void delete(String key);

    void upsertScore(String index, String member, double score);

    void removeScore(String index, String member);

    Optional<Double> score(String index, String member);

    Optional<Long> rank(String index, String member);

    /**
     * Members of {@code index} scored at or below {@code maxScore}, lowest score first.
     */
    LinkedHashMap<String, Double> rangeByScore(String index, double maxScore);

    long count(String index);

    Set<String> members(String setKey);

    void addMembers(String setKey, Collection<String> members);

    void removeMembers(String setKey, Collection<String> members);

    /**
     * Appends a message to the head of a list. Used by the Redis list dispatcher.
     */
    void push(String listKey, String value);
}
