package io.github.kemics.ebay;

import io.github.kemics.ebay.browse.BrowseService;

/**
 * Groups the eBay Buy APIs.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/buy/static/buy-landing.html</p>
 */
public final class BuyApi {

    private final BrowseService browse;

    BuyApi(EbayClient client) {
        this.browse = new BrowseService(client);
    }

    public BrowseService browse() {
        return browse;
    }
}
