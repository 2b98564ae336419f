package io.github.kemics.ebay.browse;

import java.time.Instant;
import java.util.List;

/**
 * Lightweight item view returned for the {@code COMPACT} field group: price and availability only.
 */
public record CompactItem(
    String itemId,
    String sellerItemRevision,
    Amount price,
    Amount currentBidPrice,
    Integer bidCount,
    Instant itemEndDate,
    Boolean eligibleForInlineCheckout,
    List<EstimatedAvailability> estimatedAvailabilities
) {
}
