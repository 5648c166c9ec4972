package io.attrspans.core;

import java.util.Objects;

/**
 * Attribution identified only by its name, e.g. "bold".
 * <p>
 * Two named attributions share a lane iff their names are equal, and they
 * always merge in that case.
 */
public record NamedAttribution(String name) implements Attribution {

    public static final NamedAttribution BOLD = new NamedAttribution("bold");
    public static final NamedAttribution ITALICS = new NamedAttribution("italics");
    public static final NamedAttribution UNDERLINE = new NamedAttribution("underline");
    public static final NamedAttribution STRIKETHROUGH = new NamedAttribution("strikethrough");

    public NamedAttribution {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    @Override
    public String id() {
        return name;
    }

    @Override
    public boolean canMergeWith(Attribution other) {
        return equals(other);
    }

    @Override
    public String toString() {
        return "[NamedAttribution]: " + name;
    }
}
