package com.pressroom.core.query;

import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentStatus;
import com.pressroom.core.exception.InvalidScopeException;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Named, reusable filters over {@link Content#getStatus()}.
 * Each scope narrows a read to rows in exactly one status.
 */
public enum ContentScope {
    ACTIVE(ContentStatus.ACTIVE),
    DRAFT(ContentStatus.DRAFT),
    ARCHIVED(ContentStatus.ARCHIVED);

    private final ContentStatus status;

    ContentScope(ContentStatus status) {
        this.status = status;
    }

    public String getName() {
        return status.getValue();
    }

    public ContentStatus getStatus() {
        return status;
    }

    /**
     * Predicate {@code status = <scope status>}.
     */
    public Specification<Content> specification() {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    /**
     * Resolves a scope by name, ignoring case.
     *
     * @throws InvalidScopeException for any other name, including blank ones
     */
    public static ContentScope fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ContentScope scope : values()) {
                if (scope.getName().equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new InvalidScopeException(name);
    }

    /**
     * Specification for an optional scope; {@code null} matches every row.
     */
    public static Specification<Content> filter(ContentScope scope) {
        if (scope == null) {
            return (root, query, cb) -> cb.conjunction();
        }
        return scope.specification();
    }
}
