package com.pressroom.api.read;

import java.util.List;

/**
 * One page of content.
 *
 * @param totalPages  {@code ceil(totalItems / pageSize)}, zero when nothing matches
 * @param currentPage the 1-based page that was requested
 */
public record ContentPage(List<ContentView> items, int totalPages, int currentPage, long totalItems) {

    public static ContentPage of(List<ContentView> items, long totalItems, int page, int pageSize) {
        int totalPages = (int) ((totalItems + pageSize - 1) / pageSize);
        return new ContentPage(List.copyOf(items), totalPages, page, totalItems);
    }
}
