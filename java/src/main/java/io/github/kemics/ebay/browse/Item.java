package io.github.kemics.ebay.browse;

import java.time.Instant;
import java.util.List;

/**
 * Item details returned by {@code getItem} and {@code getItemByLegacyId}. Only commonly used fields are mapped;
 * unknown fields are ignored.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item/methods/getItem</p>
 */
public record Item(
    String itemId,
    String legacyItemId,
    String title,
    String subtitle,
    String shortDescription,
    String description,
    Amount price,
    Amount currentBidPrice,
    Integer bidCount,
    String categoryPath,
    String categoryId,
    String condition,
    String conditionId,
    ItemLocation itemLocation,
    Image image,
    List<Image> additionalImages,
    String brand,
    String color,
    String gtin,
    String mpn,
    Seller seller,
    List<String> buyingOptions,
    List<EstimatedAvailability> estimatedAvailabilities,
    String itemWebUrl,
    String itemAffiliateWebUrl,
    Instant itemEndDate,
    String primaryItemGroup
) {
}
