package com.pressroom.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;

/**
 * Account - root entity of the publishing model.
 * 
 * Owns at most one {@link Profile} and any number of {@link Content} rows; both
 * reference it through {@code account_id}. Email is unique across all accounts.
 */
@Entity
@Table(name = "accounts", indexes = {
    @Index(name = "idx_accounts_email", columnList = "email")
})
public class Account {

    /**
     * Syntax accepted for {@link #email}: one {@code @}, a non-empty local part and a
     * dotted domain.
     */
    public static final String EMAIL_PATTERN = "^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(name = "first_name", nullable = false)
    private String firstName;

    @NotBlank
    @Size(max = 255)
    @Column(name = "last_name", nullable = false)
    private String lastName;

    @NotBlank
    @Size(max = 255)
    @Email(regexp = EMAIL_PATTERN, message = "must be a valid email address")
    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Account() {}

    /**
     * Creates a new, not yet persisted account.
     */
    public static Account create(String firstName, String lastName, String email) {
        Account account = new Account();
        account.firstName = firstName;
        account.lastName = lastName;
        account.email = email;
        account.createdAt = Instant.now();
        account.updatedAt = account.createdAt;
        return account;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    // Getters
    public Long getId() { return id; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public String getEmail() { return email; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    // Setters for mutable fields
    public void setFirstName(String firstName) {
        this.firstName = firstName;
        this.updatedAt = Instant.now();
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
        this.updatedAt = Instant.now();
    }

    public void setEmail(String email) {
        this.email = email;
        this.updatedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "Account{id=" + id + ", email=" + email + "}";
    }
}
