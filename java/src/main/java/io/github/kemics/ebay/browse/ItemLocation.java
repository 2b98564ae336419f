package io.github.kemics.ebay.browse;

public record ItemLocation(String city, String stateOrProvince, String postalCode, String country) {
}
