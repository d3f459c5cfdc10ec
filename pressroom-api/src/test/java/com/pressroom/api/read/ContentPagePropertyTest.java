package com.pressroom.api.read;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for page arithmetic.
 */
class ContentPagePropertyTest {

    /**
     * Property: the page count is the smallest number of pages that holds every item.
     */
    @Property(tries = 500)
    void totalPagesIsCeilingOfItemsOverPageSize(
            @ForAll @LongRange(min = 0, max = 1_000_000) long totalItems,
            @ForAll @IntRange(min = 1, max = 500) int pageSize) {

        ContentPage page = ContentPage.of(List.of(), totalItems, 1, pageSize);

        assertThat((long) page.totalPages() * pageSize).isGreaterThanOrEqualTo(totalItems);
        if (totalItems > 0) {
            assertThat((long) (page.totalPages() - 1) * pageSize).isLessThan(totalItems);
        } else {
            assertThat(page.totalPages()).isZero();
        }
    }

    /**
     * Property: the requested page number is echoed back unchanged.
     */
    @Property(tries = 100)
    void currentPageIsTheRequestedPage(@ForAll @IntRange(min = 1, max = 10_000) int requested) {
        assertThat(ContentPage.of(List.of(), 0, requested, 10).currentPage()).isEqualTo(requested);
    }

    @Example
    void fiveItemsInPagesOfTwo() {
        assertThat(ContentPage.of(List.of(), 5, 2, 2).totalPages()).isEqualTo(3);
    }
}
