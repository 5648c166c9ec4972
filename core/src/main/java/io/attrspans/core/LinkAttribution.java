package io.attrspans.core;

import java.util.Objects;

/**
 * Hyperlink attribution.
 * <p>
 * All links share the "link" lane, so two different URLs can never overlap.
 * Links with the same URL merge into one span.
 */
public record LinkAttribution(String url) implements Attribution {

    public static final String ID = "link";

    public LinkAttribution {
        Objects.requireNonNull(url, "url");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean canMergeWith(Attribution other) {
        return other instanceof LinkAttribution link && url.equals(link.url);
    }

    @Override
    public String toString() {
        return "[LinkAttribution]: " + url;
    }
}
