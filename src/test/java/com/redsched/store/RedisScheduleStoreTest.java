package com.redsched.store;

import com.redsched.config.RedschedProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.ReactiveHashOperations;
import org.springframework.data.redis.core.ReactiveListOperations;
import org.springframework.data.redis.core.ReactiveSetOperations;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import org.springframework.data.redis.core.ZSetOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RedisScheduleStoreTest {

    @Mock private ReactiveStringRedisTemplate redisTemplate;
    @Mock private ReactiveHashOperations<String, String, String> hashOps;
    @Mock private ReactiveZSetOperations<String, String> zSetOps;
    @Mock private ReactiveSetOperations<String, String> setOps;
    @Mock private ReactiveListOperations<String, String> listOps;

    private RedisScheduleStore store;

    @BeforeEach
    void setUp() {
        doReturn(hashOps).when(redisTemplate).opsForHash();
        when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        when(redisTemplate.opsForSet()).thenReturn(setOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);

        RedschedProperties properties = new RedschedProperties();
        properties.setStoreTimeout(Duration.ofMillis(200));
        store = new RedisScheduleStore(redisTemplate, properties);
    }

    @Test
    void putFieldWritesHashField() {
        when(hashOps.put("rb:test", "definition", "{}")).thenReturn(Mono.just(true));

        store.putField("rb:test", "definition", "{}");

        verify(hashOps).put("rb:test", "definition", "{}");
    }

    @Test
    void getFieldMapsMissingToEmpty() {
        when(hashOps.get("rb:test", "meta")).thenReturn(Mono.empty());
        when(hashOps.get("rb:test", "definition")).thenReturn(Mono.just("{\"name\":\"test\"}"));

        assertEquals(Optional.empty(), store.getField("rb:test", "meta"));
        assertEquals(Optional.of("{\"name\":\"test\"}"), store.getField("rb:test", "definition"));
    }

    @Test
    void existsAndDelete() {
        when(redisTemplate.hasKey("rb:test")).thenReturn(Mono.just(true), Mono.just(false));
        when(redisTemplate.delete("rb:test")).thenReturn(Mono.just(1L));

        assertTrue(store.exists("rb:test"));
        store.delete("rb:test");
        assertFalse(store.exists("rb:test"));
        verify(redisTemplate).delete("rb:test");
    }

    @Test
    void scoreOperations() {
        when(zSetOps.add(":schedule", "rb:test", 12.5)).thenReturn(Mono.just(true));
        when(zSetOps.score(":schedule", "rb:test")).thenReturn(Mono.just(12.5));
        when(zSetOps.rank(":schedule", "rb:test")).thenReturn(Mono.just(0L));
        when(zSetOps.rank(":schedule", "rb:gone")).thenReturn(Mono.empty());
        when(zSetOps.remove(":schedule", "rb:test")).thenReturn(Mono.just(1L));

        store.upsertScore(":schedule", "rb:test", 12.5);
        assertEquals(Optional.of(12.5), store.score(":schedule", "rb:test"));
        assertEquals(Optional.of(0L), store.rank(":schedule", "rb:test"));
        assertEquals(Optional.empty(), store.rank(":schedule", "rb:gone"));
        store.removeScore(":schedule", "rb:test");

        verify(zSetOps).add(":schedule", "rb:test", 12.5);
        verify(zSetOps).remove(":schedule", "rb:test");
    }

    @Test
    @SuppressWarnings("unchecked")
    void rangeByScoreIsOpenBelowAndInclusiveAbove() {
        when(zSetOps.rangeByScoreWithScores(eq(":schedule"), any(Range.class))).thenReturn(Flux.just(
                new DefaultTypedTuple<>("rb:a", 1.0),
                new DefaultTypedTuple<>("rb:b", 5.0)));

        LinkedHashMap<String, Double> result = store.rangeByScore(":schedule", 5.0);

        assertEquals(List.of("rb:a", "rb:b"), List.copyOf(result.keySet()));
        assertEquals(5.0, result.get("rb:b"));

        ArgumentCaptor<Range<Double>> range = ArgumentCaptor.forClass(Range.class);
        verify(zSetOps).rangeByScoreWithScores(eq(":schedule"), range.capture());
        assertFalse(range.getValue().getLowerBound().isBounded());
        assertTrue(range.getValue().getUpperBound().isInclusive());
        assertEquals(Optional.of(5.0), range.getValue().getUpperBound().getValue());
    }

    @Test
    void setAndListOperations() {
        when(setOps.members(":statics")).thenReturn(Flux.just("a", "b"));
        when(setOps.add(":statics", "c")).thenReturn(Mono.just(1L));
        when(setOps.remove(":statics", "a")).thenReturn(Mono.just(1L));
        when(listOps.leftPush("queue:default", "{}")).thenReturn(Mono.just(1L));
        when(zSetOps.size(":schedule")).thenReturn(Mono.just(3L));

        assertEquals(Set.of("a", "b"), store.members(":statics"));
        store.addMembers(":statics", List.of("c"));
        store.removeMembers(":statics", List.of("a"));
        store.push("queue:default", "{}");
        assertEquals(3L, store.count(":schedule"));

        verify(setOps).add(":statics", "c");
        verify(setOps).remove(":statics", "a");
        verify(listOps).leftPush("queue:default", "{}");
    }

    @Test
    void emptyMemberUpdatesSkipRedis() {
        store.addMembers(":statics", List.of());
        store.removeMembers(":statics", List.of());
        verifyNoInteractions(setOps);
    }

    @Test
    void connectionFailureIsWrapped() {
        when(hashOps.get("rb:test", "definition"))
                .thenReturn(Mono.error(new RedisConnectionFailureException("Unable to connect")));

        ScheduleStoreException e = assertThrows(ScheduleStoreException.class,
                () -> store.getField("rb:test", "definition"));
        assertInstanceOf(RedisConnectionFailureException.class, e.getCause());
    }

    @Test
    void slowStoreTimesOut() {
        when(zSetOps.size(":schedule")).thenReturn(Mono.never());
        assertThrows(ScheduleStoreException.class, () -> store.count(":schedule"));
    }
}
