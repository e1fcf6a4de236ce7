package io.herald4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for schedules.
 *
 * <p>kind and selectionPolicy are kept as strings: they are written by the CRUD layer and parsed
 * when the document is read, so a bad value disables the schedule instead of failing the mapping.
 */
@Document(collection = "schedules")
public class ScheduleDocument {

    @Id
    private String id;

    private String kind;
    private String spec;
    private String timezone;
    private Instant createdAt;
    private String contentId;
    private String templateId;
    private String selectionPolicy;
    private int noRepeatWindow;
    private String noRepeatScope;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lastRunAt;
    private Integer roundRobinCursor;
    private boolean enabled;
    private String disabledReason;
    private String lastError;

    private Instant lockedAt;
    private Instant lockUntil;
    private String lockedBy;
    private Instant updatedAt;

    public ScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSpec() {
        return spec;
    }

    public void setSpec(String spec) {
        this.spec = spec;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getContentId() {
        return contentId;
    }

    public void setContentId(String contentId) {
        this.contentId = contentId;
    }

    public String getTemplateId() {
        return templateId;
    }

    public void setTemplateId(String templateId) {
        this.templateId = templateId;
    }

    public String getSelectionPolicy() {
        return selectionPolicy;
    }

    public void setSelectionPolicy(String selectionPolicy) {
        this.selectionPolicy = selectionPolicy;
    }

    public int getNoRepeatWindow() {
        return noRepeatWindow;
    }

    public void setNoRepeatWindow(int noRepeatWindow) {
        this.noRepeatWindow = noRepeatWindow;
    }

    public String getNoRepeatScope() {
        return noRepeatScope;
    }

    public void setNoRepeatScope(String noRepeatScope) {
        this.noRepeatScope = noRepeatScope;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Integer getRoundRobinCursor() {
        return roundRobinCursor;
    }

    public void setRoundRobinCursor(Integer roundRobinCursor) {
        this.roundRobinCursor = roundRobinCursor;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDisabledReason() {
        return disabledReason;
    }

    public void setDisabledReason(String disabledReason) {
        this.disabledReason = disabledReason;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
