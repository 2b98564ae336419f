package io.github.kemics.ebay.browse;

public record Image(String imageUrl, Integer height, Integer width) {
}
