package io.herald4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Mongo document model for templates with their embedded variants.
 */
@Document(collection = "templates")
public class TemplateDocument {

    @Id
    private String id;

    private String name;
    private List<VariantDocument> variants = new ArrayList<>();

    public TemplateDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<VariantDocument> getVariants() {
        return variants;
    }

    public void setVariants(List<VariantDocument> variants) {
        this.variants = variants == null ? new ArrayList<>() : variants;
    }
}
