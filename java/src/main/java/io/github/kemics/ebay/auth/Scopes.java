package io.github.kemics.ebay.auth;

/**
 * OAuth2 scope definitions.
 *
 * <p>eBay API docs: https://developer.ebay.com/api-docs/static/oauth-scopes.html</p>
 */
public final class Scopes {

    public static final String ROOT = "https://api.ebay.com/oauth/api_scope";
    public static final String BUY_ORDER_READONLY = "https://api.ebay.com/oauth/api_scope/buy.order.readonly";
    public static final String BUY_GUEST_ORDER = "https://api.ebay.com/oauth/api_scope/buy.guest.order";
    public static final String BUY_MARKETING = "https://api.ebay.com/oauth/api_scope/buy.marketing";
    public static final String BUY_ITEM_FEED = "https://api.ebay.com/oauth/api_scope/buy.item.feed";
    public static final String BUY_OFFER_AUCTION = "https://api.ebay.com/oauth/api_scope/buy.offer.auction";
    public static final String BUY_MARKETPLACE_INSIGHTS = "https://api.ebay.com/oauth/api_scope/buy.marketplace.insights";

    private Scopes() {
    }
}
