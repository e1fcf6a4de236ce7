package io.herald4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Mongo document model for fixed content.
 *
 * <p>mediaRefs is the JSON array string written by the CRUD layer.
 */
@Document(collection = "contents")
public class ContentDocument {

    @Id
    private String id;

    private String text;
    private String mediaRefs;
    private boolean deleted;

    public ContentDocument() {
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

    public String getMediaRefs() {
        return mediaRefs;
    }

    public void setMediaRefs(String mediaRefs) {
        this.mediaRefs = mediaRefs;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public void setDeleted(boolean deleted) {
        this.deleted = deleted;
    }
}
