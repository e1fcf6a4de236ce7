package io.herald4j.selection;

import io.herald4j.core.Variant;

import java.util.List;
import java.util.Optional;

/**
 * Decides which variants may be selected or published.
 */
public class VariantValidator {

    public static final int DEFAULT_MAX_TEXT_LENGTH = 280;

    private final int maxTextLength;

    public VariantValidator() {
        this(DEFAULT_MAX_TEXT_LENGTH);
    }

    public VariantValidator(int maxTextLength) {
        if (maxTextLength <= 0) {
            throw new IllegalArgumentException("maxTextLength must be positive");
        }
        this.maxTextLength = maxTextLength;
    }

    public List<Variant> eligible(List<Variant> variants) {
        if (variants == null) {
            return List.of();
        }
        return variants.stream()
                .filter(v -> rejectionReason(v).isEmpty())
                .toList();
    }

    /**
     * Why the variant cannot be used, or empty when it can.
     */
    public Optional<String> rejectionReason(Variant variant) {
        if (variant == null) {
            return Optional.of("variant missing");
        }
        if (!variant.active()) {
            return Optional.of("variant " + variant.id() + " is inactive");
        }
        String text = variant.text();
        if (text == null || text.isBlank()) {
            return Optional.of("variant " + variant.id() + " has no text");
        }
        int length = text.codePointCount(0, text.length());
        if (length > maxTextLength) {
            return Optional.of("variant " + variant.id() + " text length " + length + " exceeds " + maxTextLength);
        }
        return Optional.empty();
    }
}
