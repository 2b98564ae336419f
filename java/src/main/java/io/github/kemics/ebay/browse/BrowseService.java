package io.github.kemics.ebay.browse;

import io.github.kemics.ebay.ApiRequest;
import io.github.kemics.ebay.CallContext;
import io.github.kemics.ebay.EbayClient;
import io.github.kemics.ebay.EbayException;
import io.github.kemics.ebay.Opt;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Handles communication with the Browse API: item lookup and keyword search.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/overview.html</p>
 */
public final class BrowseService {

    static final String FIELD_GROUP_COMPACT = "COMPACT";
    static final String FIELD_GROUP_PRODUCT = "PRODUCT";

    private final EbayClient client;

    public BrowseService(EbayClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Retrieves an item by its legacy (pre-REST) listing id.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item/methods/getItemByLegacyId</p>
     */
    public Item getItemByLegacyId(CallContext ctx, String legacyItemId, Opt... opts) throws EbayException {
        Objects.requireNonNull(legacyItemId, "legacyItemId");
        ApiRequest request = client.newRequest("GET", "buy/browse/v1/item/get_item_by_legacy_id", null,
            withLeading(r -> r.setQueryParam("legacy_item_id", legacyItemId), opts));
        return client.execute(ctx, request, Item.class);
    }

    /**
     * Retrieves the price and availability of an item.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item/methods/getItem</p>
     */
    public CompactItem getCompactItem(CallContext ctx, String itemId, Opt... opts) throws EbayException {
        ApiRequest request = client.newRequest("GET", itemPath(itemId), null,
            withLeading(r -> r.setQueryParam("fieldgroups", FIELD_GROUP_COMPACT), opts));
        return client.execute(ctx, request, CompactItem.class);
    }

    /**
     * Retrieves the full details of an item, including product information.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item/methods/getItem</p>
     */
    public Item getItem(CallContext ctx, String itemId, Opt... opts) throws EbayException {
        ApiRequest request = client.newRequest("GET", itemPath(itemId), null,
            withLeading(r -> r.setQueryParam("fieldgroups", FIELD_GROUP_PRODUCT), opts));
        return client.execute(ctx, request, Item.class);
    }

    /**
     * Retrieves all items of an item group, i.e. the variations of a multi-variation listing.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item/methods/getItemsByItemGroup</p>
     */
    public ItemsByGroup getItemsByGroupId(CallContext ctx, String itemGroupId, Opt... opts) throws EbayException {
        Objects.requireNonNull(itemGroupId, "itemGroupId");
        ApiRequest request = client.newRequest("GET", "buy/browse/v1/item/get_items_by_item_group", null,
            withLeading(r -> r.setQueryParam("item_group_id", itemGroupId), opts));
        return client.execute(ctx, request, ItemsByGroup.class);
    }

    /**
     * Searches for items by keyword, category or other criteria given as options.
     *
     * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/browse/resources/item_summary/methods/search</p>
     */
    public SearchResult search(CallContext ctx, Opt... opts) throws EbayException {
        ApiRequest request = client.newRequest("GET", "buy/browse/v1/item_summary/search", null, opts);
        return client.execute(ctx, request, SearchResult.class);
    }

    private static String itemPath(String itemId) {
        Objects.requireNonNull(itemId, "itemId");
        String segment = URLEncoder.encode(itemId, StandardCharsets.UTF_8).replace("+", "%20");
        return "buy/browse/v1/item/" + segment;
    }

    private static List<Opt> withLeading(Opt first, Opt... opts) {
        List<Opt> all = new ArrayList<>();
        all.add(first);
        if (opts != null) {
            all.addAll(Arrays.asList(opts));
        }
        return all;
    }
}
