package io.attrspans.cli.dto;

/**
 * Attribution as written in a script:
 *   {"type": "named", "name": "bold"}
 *   {"type": "link",  "url": "https://example.com"}
 * A missing type means "named".
 */
public class AttributionJson {
    public String type;
    public String name;
    public String url;
}
