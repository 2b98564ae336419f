package io.github.kemics.ebay.browse;

import io.github.kemics.ebay.Opt;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Options for the Browse API.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/static/api-browse.html</p>
 */
public final class BrowseOptions {

    public static final String END_USER_CONTEXT_HEADER = "X-EBAY-C-ENDUSERCTX";
    public static final String MARKETPLACE_ID_HEADER = "X-EBAY-C-MARKETPLACE-ID";

    private BrowseOptions() {
    }

    /**
     * Adds the contextual location of the end user to {@code X-EBAY-C-ENDUSERCTX}, appending to any value already
     * present. Shipping estimates in responses are computed for that location.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/static/api-browse.html#Headers</p>
     */
    public static Opt contextualLocation(String country, String zip) {
        String location = "contextualLocation="
            + URLEncoder.encode("country=" + country + ",zip=" + zip, StandardCharsets.UTF_8);
        return request -> {
            String existing = request.header(END_USER_CONTEXT_HEADER);
            String value = existing == null || existing.isEmpty() ? location : existing + "," + location;
            return request.setHeader(END_USER_CONTEXT_HEADER, value);
        };
    }

    /**
     * Selects the marketplace, e.g. {@code EBAY_US} or {@code EBAY_DE}.
     */
    public static Opt marketplaceId(String marketplaceId) {
        Objects.requireNonNull(marketplaceId, "marketplaceId");
        return request -> request.setHeader(MARKETPLACE_ID_HEADER, marketplaceId);
    }

    /**
     * Keywords to search for.
     */
    public static Opt search(String q) {
        return request -> request.setQueryParam("q", q);
    }

    /**
     * Maximum number of items per page.
     */
    public static Opt searchLimit(int limit) {
        return request -> request.setQueryParam("limit", Integer.toString(limit));
    }

    /**
     * Number of items to skip in the result set.
     */
    public static Opt searchOffset(int offset) {
        return request -> request.setQueryParam("offset", Integer.toString(offset));
    }

    public static Opt searchCategoryIds(String... categoryIds) {
        return request -> request.setQueryParam("category_ids", join(categoryIds));
    }

    /**
     * Raw filter expression such as {@code price:[10..50],priceCurrency:USD}.
     */
    public static Opt searchFilter(String filter) {
        return request -> request.setQueryParam("filter", filter);
    }

    public static Opt searchSort(String sort) {
        return request -> request.setQueryParam("sort", sort);
    }

    public static Opt searchFieldGroups(String... fieldGroups) {
        return request -> request.setQueryParam("fieldgroups", join(fieldGroups));
    }

    private static String join(String... values) {
        if (values == null) {
            return "";
        }
        return Arrays.stream(values)
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.joining(","));
    }
}
