package com.pressroom.core.query;

import com.pressroom.core.domain.ContentStatus;
import com.pressroom.core.exception.InvalidScopeException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for content scopes.
 */
class ContentScopePropertyTest {

    /**
     * Property: every scope resolves from its own name regardless of case and padding.
     */
    @Property(tries = 100)
    void scopeNames_resolveIgnoringCase(
            @ForAll ContentScope scope,
            @ForAll boolean upper,
            @ForAll @IntRange(min = 0, max = 3) int padding) {

        String name = upper ? scope.getName().toUpperCase() : scope.getName();
        String padded = " ".repeat(padding) + name + " ".repeat(padding);

        assertThat(ContentScope.fromName(padded)).isEqualTo(scope);
    }

    /**
     * Property: names other than the three statuses are rejected, never ignored.
     */
    @Property(tries = 200)
    void unknownNames_rejected(@ForAll @AlphaChars @StringLength(min = 0, max = 12) String name) {
        Assume.that(!name.equalsIgnoreCase("active")
                && !name.equalsIgnoreCase("draft")
                && !name.equalsIgnoreCase("archived"));

        assertThatThrownBy(() -> ContentScope.fromName(name))
                .isInstanceOf(InvalidScopeException.class)
                .hasMessageContaining("Unknown scope");
    }

    @Example
    void nullName_rejected() {
        assertThatThrownBy(() -> ContentScope.fromName(null)).isInstanceOf(InvalidScopeException.class);
    }

    @Example
    void eachScope_filtersOnItsOwnStatus() {
        assertThat(ContentScope.ACTIVE.getStatus()).isEqualTo(ContentStatus.ACTIVE);
        assertThat(ContentScope.DRAFT.getStatus()).isEqualTo(ContentStatus.DRAFT);
        assertThat(ContentScope.ARCHIVED.getStatus()).isEqualTo(ContentStatus.ARCHIVED);
        assertThat(ContentScope.filter(null)).isNotNull();
        assertThat(ContentScope.filter(ContentScope.DRAFT)).isNotNull();
    }
}
