package io.github.kemics.ebay.browse;

public record Seller(String username, String feedbackPercentage, Integer feedbackScore) {
}
