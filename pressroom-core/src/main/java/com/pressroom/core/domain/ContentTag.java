package com.pressroom.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Join entity for the many-to-many relationship between content and tags.
 * One row records one (content, tag) pairing.
 */
@Entity
@Table(name = "content_tags", indexes = {
    @Index(name = "idx_content_tags_content", columnList = "content_id"),
    @Index(name = "idx_content_tags_tag", columnList = "tag_id")
})
public class ContentTag {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotNull
    @Column(name = "content_id", nullable = false, updatable = false)
    private Long contentId;

    @NotNull
    @Column(name = "tag_id", nullable = false, updatable = false)
    private Long tagId;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ContentTag() {
        // JPA constructor
    }

    public ContentTag(Long contentId, Long tagId) {
        if (contentId == null) {
            throw new IllegalArgumentException("Content ID cannot be null");
        }
        if (tagId == null) {
            throw new IllegalArgumentException("Tag ID cannot be null");
        }
        this.contentId = contentId;
        this.tagId = tagId;
        this.createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public Long getContentId() { return contentId; }
    public Long getTagId() { return tagId; }
    public Instant getCreatedAt() { return createdAt; }
}
