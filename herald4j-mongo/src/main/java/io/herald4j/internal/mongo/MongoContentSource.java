package io.herald4j.internal.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald4j.ContentSource;
import io.herald4j.core.FixedContent;
import io.herald4j.core.ValidationException;
import io.herald4j.core.Variant;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ContentSource} reading the templates and contents collections.
 */
public class MongoContentSource implements ContentSource {

    private static final TypeReference<List<String>> MEDIA_REFS = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoContentSource(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<Variant> activeVariants(String templateId) {
        TemplateDocument template = mongoTemplate.findById(templateId, TemplateDocument.class);
        if (template == null) {
            return List.of();
        }
        return template.getVariants().stream()
                .filter(VariantDocument::isActive)
                .map(v -> toVariant(templateId, v))
                .toList();
    }

    @Override
    public Optional<Variant> findVariant(String templateId, String variantId) {
        TemplateDocument template = mongoTemplate.findById(templateId, TemplateDocument.class);
        if (template == null) {
            return Optional.empty();
        }
        return template.getVariants().stream()
                .filter(v -> Objects.equals(v.getId(), variantId))
                .findFirst()
                .map(v -> toVariant(templateId, v));
    }

    /**
     * @throws ValidationException if the stored mediaRefs is not a JSON array of strings
     */
    @Override
    public Optional<FixedContent> fixedContent(String contentId) {
        ContentDocument doc = mongoTemplate.findById(contentId, ContentDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new FixedContent(doc.getId(), doc.getText(), parseMediaRefs(doc), doc.isDeleted()));
    }

    private List<String> parseMediaRefs(ContentDocument doc) {
        String raw = doc.getMediaRefs();
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            List<String> refs = objectMapper.readValue(raw, MEDIA_REFS);
            return refs == null ? List.of() : refs.stream().filter(Objects::nonNull).toList();
        } catch (JsonProcessingException e) {
            throw new ValidationException("Content " + doc.getId() + " has malformed mediaRefs: " + e.getOriginalMessage(), e);
        }
    }

    private static Variant toVariant(String templateId, VariantDocument v) {
        return new Variant(v.getId(), templateId, v.getText(), v.getWeight(), v.isActive());
    }
}
