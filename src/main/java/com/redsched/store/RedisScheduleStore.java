package com.redsched.store;

import com.redsched.config.RedschedProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ScheduleStore} backed by Redis through the reactive string template.
 * Each call blocks for at most {@code redsched.store-timeout}.
 */
@Component
public class RedisScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(RedisScheduleStore.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final Duration timeout;

    public RedisScheduleStore(ReactiveStringRedisTemplate redisTemplate,
                              RedschedProperties properties) {
        this.redisTemplate = redisTemplate;
        this.timeout = properties.getStoreTimeout();
    }

    @Override
    public void putField(String key, String field, String value) {
        await("HSET " + key, redisTemplate.<String, String>opsForHash().put(key, field, value));
    }

    @Override
    public Optional<String> getField(String key, String field) {
        return Optional.ofNullable(
                await("HGET " + key, redisTemplate.<String, String>opsForHash().get(key, field)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(await("EXISTS " + key, redisTemplate.hasKey(key)));
    }

    @Override
    public void delete(String key) {
        await("DEL " + key, redisTemplate.delete(key));
    }

    @Override
    public void upsertScore(String index, String member, double score) {
        await("ZADD " + index, redisTemplate.opsForZSet().add(index, member, score));
    }

    @Override
    public void removeScore(String index, String member) {
        await("ZREM " + index, redisTemplate.opsForZSet().remove(index, member));
    }

    @Override
    public Optional<Double> score(String index, String member) {
        return Optional.ofNullable(await("ZSCORE " + index, redisTemplate.opsForZSet().score(index, member)));
    }

    @Override
    public Optional<Long> rank(String index, String member) {
        return Optional.ofNullable(await("ZRANK " + index, redisTemplate.opsForZSet().rank(index, member)));
    }

    @Override
    public LinkedHashMap<String, Double> rangeByScore(String index, double maxScore) {
        Range<Double> range = Range.of(Range.Bound.unbounded(), Range.Bound.inclusive(maxScore));
        List<ZSetOperations.TypedTuple<String>> tuples = await("ZRANGEBYSCORE " + index,
                redisTemplate.opsForZSet().rangeByScoreWithScores(index, range).collectList());

        LinkedHashMap<String, Double> result = new LinkedHashMap<>();
        if (tuples != null) {
            for (ZSetOperations.TypedTuple<String> tuple : tuples) {
                result.put(tuple.getValue(), tuple.getScore());
            }
        }
        return result;
    }

    @Override
    public long count(String index) {
        Long size = await("ZCARD " + index, redisTemplate.opsForZSet().size(index));
        return size != null ? size : 0L;
    }

    @Override
    public Set<String> members(String setKey) {
        List<String> members = await("SMEMBERS " + setKey,
                redisTemplate.opsForSet().members(setKey).collectList());
        return members != null ? new LinkedHashSet<>(members) : Set.of();
    }

    @Override
    public void addMembers(String setKey, Collection<String> members) {
        if (members.isEmpty()) return;
        await("SADD " + setKey, redisTemplate.opsForSet().add(setKey, members.toArray(new String[0])));
    }

    @Override
    public void removeMembers(String setKey, Collection<String> members) {
        if (members.isEmpty()) return;
        await("SREM " + setKey, redisTemplate.opsForSet().remove(setKey, members.toArray()));
    }

    @Override
    public void push(String listKey, String value) {
        await("LPUSH " + listKey, redisTemplate.opsForList().leftPush(listKey, value));
    }

    private <T> T await(String operation, Mono<T> result) {
        try {
            return result.block(timeout);
        } catch (RuntimeException e) {
            log.debug("Redis operation failed: {}", operation, e);
            throw new ScheduleStoreException("Redis operation failed: " + operation, e);
        }
    }
}
