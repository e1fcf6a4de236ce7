package io.herald4j.internal.redis;

import io.herald4j.DedupeGuard;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Redis SET-NX guard around one (schedule, occurrence).
 *
 * <p>Fails open: when Redis is unreachable the caller proceeds and the job unique index decides. Release only
 * removes a key this instance still owns.
 */
public class RedissonDedupeGuard implements DedupeGuard {
    private static final Logger log = LoggerFactory.getLogger(RedissonDedupeGuard.class);

    static final String KEY_PREFIX = "herald:dedupe:";

    private final RedissonClient redissonClient;
    private final Duration ttl;
    private final String owner;

    public RedissonDedupeGuard(RedissonClient redissonClient, Duration ttl, String owner) {
        this.redissonClient = Objects.requireNonNull(redissonClient, "redissonClient must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be a positive duration");
        }
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
    }

    @Override
    public boolean tryAcquire(String scheduleId, Instant plannedAt) {
        String key = key(scheduleId, plannedAt);
        try {
            RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
            boolean acquired = bucket.trySet(owner, Math.max(1, ttl.toSeconds()), TimeUnit.SECONDS);
            if (!acquired) {
                log.debug("herald dedupe key held key={}", key);
            }
            return acquired;
        } catch (Exception e) {
            log.warn("herald dedupe acquire failed, proceeding key={} msg={}", key, e.getMessage());
            return true;
        }
    }

    @Override
    public void release(String scheduleId, Instant plannedAt) {
        String key = key(scheduleId, plannedAt);
        try {
            RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
            // compare-and-delete: after a TTL expiry the key may belong to another instance
            if (!bucket.compareAndSet(owner, null)) {
                log.debug("herald dedupe key not owned, left in place key={} owner={}", key, owner);
            }
        } catch (Exception e) {
            log.warn("herald dedupe release failed key={} msg={}", key, e.getMessage());
        }
    }

    static String key(String scheduleId, Instant plannedAt) {
        return KEY_PREFIX + scheduleId + ":" + plannedAt;
    }
}
