package io.herald4j.core;

import java.util.Objects;

public record PublishResult(String externalId) {

    public PublishResult {
        Objects.requireNonNull(externalId, "externalId must not be null");
        if (externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
    }
}
