package io.github.kemics.ebay.browse;

import java.util.List;

/**
 * Items sharing an item group (variations of one listing).
 */
public record ItemsByGroup(List<Item> items, List<CommonDescription> commonDescriptions) {

    public ItemsByGroup {
        items = items == null ? List.of() : List.copyOf(items);
        commonDescriptions = commonDescriptions == null ? List.of() : List.copyOf(commonDescriptions);
    }

    public record CommonDescription(String description, List<String> itemIds) {
    }
}
