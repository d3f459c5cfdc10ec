package com.pressroom.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Profile - optional extra details for an {@link Account}, at most one per account.
 * Looked up by {@code accountId}, never by its own id, from outside the core.
 */
@Entity
@Table(name = "profiles")
public class Profile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @NotNull
    @Column(name = "account_id", nullable = false, unique = true, updatable = false)
    private Long accountId;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Profile() {}

    public static Profile create(Long accountId, String description) {
        Profile profile = new Profile();
        profile.accountId = accountId;
        profile.description = description;
        profile.createdAt = Instant.now();
        profile.updatedAt = profile.createdAt;
        return profile;
    }

    public Long getId() { return id; }
    public String getDescription() { return description; }
    public Long getAccountId() { return accountId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void setDescription(String description) {
        this.description = description;
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Profile{id=" + id + ", accountId=" + accountId + "}";
    }
}
