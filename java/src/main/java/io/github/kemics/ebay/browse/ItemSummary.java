package io.github.kemics.ebay.browse;

import java.util.List;

public record ItemSummary(
    String itemId,
    String legacyItemId,
    String title,
    Amount price,
    Amount currentBidPrice,
    Integer bidCount,
    String condition,
    String conditionId,
    Image image,
    Seller seller,
    ItemLocation itemLocation,
    List<String> buyingOptions,
    String itemGroupHref,
    String itemGroupType,
    String itemHref,
    String itemWebUrl,
    String itemAffiliateWebUrl
) {
}
