package io.github.kemics.ebay.browse;

/**
 * Monetary amount as returned by eBay, e.g. {@code {"value":"12.50","currency":"USD"}}.
 */
public record Amount(String value, String currency) {
}
