package io.github.kemics.ebay.browse;

import java.util.List;

public record EstimatedAvailability(
    List<String> deliveryOptions,
    String estimatedAvailabilityStatus,
    Integer estimatedAvailableQuantity,
    Integer estimatedSoldQuantity
) {
}
