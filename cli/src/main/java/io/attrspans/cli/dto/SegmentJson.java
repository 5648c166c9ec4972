package io.attrspans.cli.dto;

import java.util.List;

/** One collapsed segment as printed by the "collapse" command. */
public class SegmentJson {
    public int start;
    public int end;
    public List<String> attributions;

    public SegmentJson() {
    }

    public SegmentJson(int start, int end, List<String> attributions) {
        this.start = start;
        this.end = end;
        this.attributions = attributions;
    }
}
