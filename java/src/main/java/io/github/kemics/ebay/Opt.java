package io.github.kemics.ebay;

/**
 * Functional option applied to an outgoing request before it is sent, typically to add query parameters or
 * headers. Options run in the order they are passed and must only touch headers and query parameters.
 */
@FunctionalInterface
public interface Opt {

    ApiRequest.Builder apply(ApiRequest.Builder request);
}
