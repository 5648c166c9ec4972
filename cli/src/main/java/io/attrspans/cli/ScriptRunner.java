// file: cli/src/main/java/io/attrspans/cli/ScriptRunner.java
package io.attrspans.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.attrspans.cli.dto.AttributionJson;
import io.attrspans.cli.dto.EditOperation;
import io.attrspans.cli.dto.EditScript;
import io.attrspans.cli.dto.SegmentJson;
import io.attrspans.core.AttributedSpans;
import io.attrspans.core.Attribution;
import io.attrspans.core.IncompatibleOverlapException;
import io.attrspans.core.LinkAttribution;
import io.attrspans.core.MultiAttributionSpan;
import io.attrspans.core.NamedAttribution;
import io.attrspans.core.SpanMarker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads JSON edit scripts and replays them against a fresh {@link AttributedSpans}.
 * <p>
 * Responsibilities:
 *  - JSON &lt;-&gt; DTO mapping with Jackson.
 *  - Translating script attributions into engine attributions.
 *  - Reporting failing operations with their position in the script.
 */
public final class ScriptRunner {

    private static final Logger log = Logger.getLogger(ScriptRunner.class.getName());

    private final ObjectMapper mapper;

    public ScriptRunner() {
        this(new ObjectMapper());
    }

    ScriptRunner(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public EditScript load(Path path) {
        try {
            return mapper.readValue(path.toFile(), EditScript.class);
        } catch (IOException e) {
            throw new ScriptException("Failed to load edit script from " + path + ": " + e.getMessage(), e);
        }
    }

    public EditScript parse(String json) {
        try {
            return mapper.readValue(json, EditScript.class);
        } catch (JsonProcessingException e) {
            throw new ScriptException("Invalid edit script: " + e.getOriginalMessage(), e);
        }
    }

    /** Apply every operation of {@code script} in order to empty spans. */
    public AttributedSpans replay(EditScript script) {
        if (script.contentLength != null && script.contentLength < 0) {
            throw new ScriptException("\"contentLength\" must be >= 0: " + script.contentLength);
        }
        AttributedSpans spans = new AttributedSpans();
        if (script.operations == null) {
            return spans;
        }
        for (int i = 0; i < script.operations.size(); i++) {
            EditOperation op = script.operations.get(i);
            String where = "operation #" + i + " (" + op.op + ")";
            try {
                apply(spans, op, where);
            } catch (IncompatibleOverlapException | IllegalArgumentException e) {
                throw new ScriptException(where + ": " + e.getMessage(), e);
            }
        }
        log.fine(() -> "replayed " + script.operations.size() + " operations: " + spans);
        return spans;
    }

    private static void apply(AttributedSpans spans, EditOperation op, String where) {
        if (op.op == null) {
            throw new ScriptException(where + ": missing \"op\"");
        }
        switch (op.op) {
            case "add" -> spans.addAttribution(
                    toAttribution(op.attribution, where), required(op.start, "start", where), required(op.end, "end", where));
            case "remove" -> spans.removeAttribution(
                    toAttribution(op.attribution, where), required(op.start, "start", where), required(op.end, "end", where));
            case "toggle" -> spans.toggleAttribution(
                    toAttribution(op.attribution, where), required(op.start, "start", where), required(op.end, "end", where));
            case "contract" -> spans.contractAttributions(
                    nonNegative(op.start, "start", where), nonNegative(op.count, "count", where));
            case "push" -> spans.pushAttributionsBack(nonNegative(op.offset, "offset", where));
            default -> throw new ScriptException(where + ": unknown op");
        }
    }

    static Attribution toAttribution(AttributionJson json, String where) {
        if (json == null) {
            throw new ScriptException(where + ": missing \"attribution\"");
        }
        String type = json.type == null ? "named" : json.type;
        return switch (type) {
            case "named" -> {
                if (json.name == null) throw new ScriptException(where + ": named attribution requires \"name\"");
                yield new NamedAttribution(json.name);
            }
            case "link" -> {
                if (json.url == null) throw new ScriptException(where + ": link attribution requires \"url\"");
                yield new LinkAttribution(json.url);
            }
            default -> throw new ScriptException(where + ": unknown attribution type: " + type);
        };
    }

    private static int required(Integer value, String field, String where) {
        if (value == null) {
            throw new ScriptException(where + ": missing \"" + field + "\"");
        }
        return value;
    }

    private static int nonNegative(Integer value, String field, String where) {
        int v = required(value, field, where);
        if (v < 0) {
            throw new ScriptException(where + ": \"" + field + "\" must be >= 0, got " + v);
        }
        return v;
    }

    // ---------- output ----------

    /** One line per marker: {@code <offset> <START|END> <label>}. */
    public List<String> describeMarkers(AttributedSpans spans) {
        List<String> lines = new ArrayList<>();
        for (SpanMarker m : spans.markers()) {
            lines.add(m.offset() + " " + m.type() + " " + label(m.attribution()));
        }
        return lines;
    }

    /** Collapsed segments as pretty-printed JSON. */
    public String collapsedJson(AttributedSpans spans, int contentLength) {
        List<SegmentJson> out = new ArrayList<>();
        for (MultiAttributionSpan segment : spans.collapseSpans(contentLength)) {
            List<String> labels = segment.attributions().stream().map(ScriptRunner::label).toList();
            out.add(new SegmentJson(segment.start(), segment.end(), labels));
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize segments", e);
        }
    }

    static String label(Attribution attribution) {
        if (attribution instanceof NamedAttribution named) {
            return named.name();
        }
        if (attribution instanceof LinkAttribution link) {
            return "link(" + link.url() + ")";
        }
        return attribution.toString();
    }
}
