package com.example.contentpipeline.domain.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;


@Entity
@Table(name = "pipeline_executions")
public class ExecutionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false, unique = true)
    private String workflowId;

    @Column(name = "item_id", nullable = false)
    private String itemId;

    @Column(name = "source_language")
    private String sourceLanguage;

    @Column(name = "target_language", nullable = false)
    private String targetLanguage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private OutcomeStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private PipelineFailureKind failureKind;

    @Enumerated(EnumType.STRING)
    @Column(name = "failed_stage")
    private PipelineStage failedStage;

    @Column(name = "cause_type")
    private String causeType;

    @Column(name = "message", length = 2000)
    private String message;

    @Column(name = "submitted_at", nullable = false)
    @CreationTimestamp
    private LocalDateTime submittedAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public ExecutionRecord() {}

    public ExecutionRecord(String workflowId, WorkItem workItem) {
        this.workflowId = workflowId;
        this.itemId = workItem.itemId();
        this.sourceLanguage = workItem.sourceLanguage();
        this.targetLanguage = workItem.targetLanguage();
        this.status = OutcomeStatus.SUBMITTED;
    }

    public void applyOutcome(PipelineOutcome outcome) {
        this.status = outcome.status();
        this.failureKind = outcome.failureKind();
        this.failedStage = outcome.failedStage();
        this.causeType = outcome.causeType();
        this.message = outcome.message();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getWorkflowId() { return workflowId; }
    public void setWorkflowId(String workflowId) { this.workflowId = workflowId; }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }

    public String getSourceLanguage() { return sourceLanguage; }
    public void setSourceLanguage(String sourceLanguage) { this.sourceLanguage = sourceLanguage; }

    public String getTargetLanguage() { return targetLanguage; }
    public void setTargetLanguage(String targetLanguage) { this.targetLanguage = targetLanguage; }

    public OutcomeStatus getStatus() { return status; }
    public void setStatus(OutcomeStatus status) { this.status = status; }

    public PipelineFailureKind getFailureKind() { return failureKind; }
    public void setFailureKind(PipelineFailureKind failureKind) { this.failureKind = failureKind; }

    public PipelineStage getFailedStage() { return failedStage; }
    public void setFailedStage(PipelineStage failedStage) { this.failedStage = failedStage; }

    public String getCauseType() { return causeType; }
    public void setCauseType(String causeType) { this.causeType = causeType; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public LocalDateTime getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(LocalDateTime submittedAt) { this.submittedAt = submittedAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "ExecutionRecord{" +
                "workflowId='" + workflowId + '\'' +
                ", itemId='" + itemId + '\'' +
                ", targetLanguage='" + targetLanguage + '\'' +
                ", status=" + status +
                ", failureKind=" + failureKind +
                '}';
    }
}
