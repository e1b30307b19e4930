package com.cronq;

import com.cronq.schedule.ScheduleExpression;
import com.cronq.schedule.ScheduleExpressionConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "cronq_jobs")
public class Job {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String type;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private com.fasterxml.jackson.databind.JsonNode payload;

    @Convert(converter = ScheduleExpressionConverter.class)
    @Column(name = "schedule", columnDefinition = "text", updatable = false)
    private ScheduleExpression schedule = ScheduleExpression.none();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "locked_at")
    private OffsetDateTime lockedAt;

    @Column(name = "locked_by")
    private String lockedBy;

    @Column(name = "processing_started_at")
    private OffsetDateTime processingStartedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "run_at", nullable = false)
    private OffsetDateTime runAt;

    protected Job() {
    }

    public Job(UUID id, String type, com.fasterxml.jackson.databind.JsonNode payload, ScheduleExpression schedule,
            OffsetDateTime createdAt, OffsetDateTime runAt) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.schedule = schedule == null ? ScheduleExpression.none() : schedule;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.runAt = runAt;
    }

    public UUID getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public com.fasterxml.jackson.databind.JsonNode getPayload() {
        return payload;
    }

    public ScheduleExpression getSchedule() {
        return schedule == null ? ScheduleExpression.none() : schedule;
    }

    @Transient
    public String getStatus() {
        if (failedAt != null) {
            return "FAILED";
        }
        if (processingStartedAt != null) {
            return "PROCESSING";
        }
        return "PENDING";
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public OffsetDateTime getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(OffsetDateTime lockedAt) {
        this.lockedAt = lockedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public OffsetDateTime getProcessingStartedAt() {
        return processingStartedAt;
    }

    public void setProcessingStartedAt(OffsetDateTime processingStartedAt) {
        this.processingStartedAt = processingStartedAt;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(OffsetDateTime failedAt) {
        this.failedAt = failedAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public OffsetDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(OffsetDateTime runAt) {
        this.runAt = runAt;
    }
}
