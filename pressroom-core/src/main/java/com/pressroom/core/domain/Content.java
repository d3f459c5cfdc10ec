package com.pressroom.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Content - an authored item owned by exactly one {@link Account}.
 * 
 * Tags are attached through {@link ContentTag} join rows; the entity itself only
 * carries the owning account's id, so loading a Content never pulls in relations.
 */
@Entity
@Table(name = "contents", indexes = {
    @Index(name = "idx_contents_account", columnList = "account_id"),
    @Index(name = "idx_contents_status_created", columnList = "status, created_at")
})
public class Content {

    /**
     * Shortest title accepted when a title is changed.
     */
    public static final int MIN_UPDATED_TITLE_LENGTH = 5;

    /**
     * Status a new content row carries when none is given.
     */
    public static final ContentStatus DEFAULT_STATUS = ContentStatus.DRAFT;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "title", nullable = false)
    private String title;

    @NotBlank
    @Column(name = "body", nullable = false, columnDefinition = "TEXT")
    private String body;

    @NotNull
    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    @NotNull
    @Column(name = "status", nullable = false, length = 16)
    private ContentStatus status = DEFAULT_STATUS;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Content() {}

    /**
     * Creates a new content row for an account. A {@code null} status falls back to
     * {@link #DEFAULT_STATUS}.
     */
    public static Content create(Long accountId, String title, String body, ContentStatus status) {
        Content content = new Content();
        content.accountId = accountId;
        content.title = title;
        content.body = body;
        content.status = status != null ? status : DEFAULT_STATUS;
        content.createdAt = Instant.now();
        content.updatedAt = content.createdAt;
        return content;
    }


    // Getters
    public Long getId() { return id; }
    public String getTitle() { return title; }
    public String getBody() { return body; }
    public Long getAccountId() { return accountId; }
    public ContentStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters for mutable fields
    public void setTitle(String title) {
        this.title = title;
        this.updatedAt = Instant.now();
    }

    public void setBody(String body) {
        this.body = body;
        this.updatedAt = Instant.now();
    }

    public void setStatus(ContentStatus status) {
        this.status = status;
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Content{id=" + id + ", title=" + title + ", status=" + status + "}";
    }
}
