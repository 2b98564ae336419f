package io.github.kemics.ebay.browse;

import io.github.kemics.ebay.ErrorDetail;

import java.util.List;

/**
 * One page of keyword search results. {@code next} and {@code prev} hold the hrefs of neighbouring pages.
 */
public record SearchResult(
    String href,
    int total,
    String next,
    String prev,
    Integer limit,
    Integer offset,
    List<ItemSummary> itemSummaries,
    List<ErrorDetail> warnings
) {

    public SearchResult {
        itemSummaries = itemSummaries == null ? List.of() : List.copyOf(itemSummaries);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
