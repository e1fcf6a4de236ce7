package io.herald4j.recurrence;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.herald4j.utils.Digests;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.function.Supplier;

/**
 * Bounded cache of compiled recurrence rules.
 *
 * <p>The key carries a digest of the spec and the derived start, so editing a schedule simply yields a new
 * key and the old entry ages out.
 */
public class CompiledRuleCache {

    public static final int DEFAULT_MAXIMUM_SIZE = 1000;

    private final Cache<RuleKey, CompiledRule> cache;

    public CompiledRuleCache() {
        this(DEFAULT_MAXIMUM_SIZE);
    }

    public CompiledRuleCache(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public CompiledRule get(String scheduleId, String spec, ZoneId zone, LocalDateTime start,
                            Supplier<CompiledRule> compiler) {
        RuleKey key = new RuleKey(scheduleId, Digests.sha256Hex(spec), zone, start);
        return cache.get(key, k -> compiler.get());
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    record RuleKey(String scheduleId, String specHash, ZoneId zone, LocalDateTime start) {
    }
}
