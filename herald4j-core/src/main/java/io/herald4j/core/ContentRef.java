package io.herald4j.core;

/**
 * What a schedule publishes: either one fixed content item or a template whose variants are selected per occurrence.
 * Exactly one of the two ids is set.
 */
public record ContentRef(String contentId, String templateId) {

    public ContentRef {
        boolean hasContent = isPresent(contentId);
        boolean hasTemplate = isPresent(templateId);
        if (hasContent == hasTemplate) {
            throw new ValidationException(
                    "Exactly one of contentId or templateId must be set (contentId=" + contentId
                            + ", templateId=" + templateId + ")");
        }
        // a blank id is stored as absent
        contentId = hasContent ? contentId : null;
        templateId = hasTemplate ? templateId : null;
    }

    public static ContentRef fixed(String contentId) {
        return new ContentRef(contentId, null);
    }

    public static ContentRef template(String templateId) {
        return new ContentRef(null, templateId);
    }

    public boolean isTemplateBased() {
        return isPresent(templateId);
    }

    private static boolean isPresent(String id) {
        return id != null && !id.isBlank();
    }
}
