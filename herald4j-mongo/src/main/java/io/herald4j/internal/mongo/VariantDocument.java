package io.herald4j.internal.mongo;

/**
 * Variant embedded in {@link TemplateDocument}.
 */
public class VariantDocument {

    private String id;
    private String text;
    private double weight;
    private boolean active;

    public VariantDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public double getWeight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
