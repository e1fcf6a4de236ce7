package io.herald4j.selection;

import io.herald4j.utils.Digests;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Derives the selection seed of an occurrence.
 *
 * <p>seed = first 8 bytes (big-endian) of SHA-256("scheduleId:plannedAt"), plannedAt rendered in UTC at second
 * precision as {@code 2024-01-02T15:00:00Z}. The same occurrence always yields the same seed.
 */
public final class SelectionSeeds {

    private static final DateTimeFormatter PLANNED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX")
            .withZone(ZoneOffset.UTC);

    private SelectionSeeds() {
    }

    public static long seed(String scheduleId, Instant plannedAt) {
        Objects.requireNonNull(scheduleId, "scheduleId must not be null");
        Objects.requireNonNull(plannedAt, "plannedAt must not be null");
        byte[] digest = Digests.sha256(scheduleId + ":" + canonical(plannedAt));
        return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    }

    static String canonical(Instant plannedAt) {
        return PLANNED_AT.format(plannedAt.truncatedTo(ChronoUnit.SECONDS));
    }
}
