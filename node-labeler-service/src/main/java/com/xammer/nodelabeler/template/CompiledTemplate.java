package com.xammer.nodelabeler.template;

import java.util.List;
import java.util.Objects;

/**
 * Ordered literal/token segments of a template, plus the source text it was compiled from.
 */
public final class CompiledTemplate {

    public static final String DEFAULT_TEMPLATE = "{:last}";

    private final String source;
    private final List<Segment> segments;

    CompiledTemplate(String source, List<Segment> segments) {
        this.source = Objects.requireNonNull(source, "source");
        this.segments = List.copyOf(segments);
    }

    public String getSource() {
        return source;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledTemplate)) return false;
        CompiledTemplate that = (CompiledTemplate) o;
        return source.equals(that.source) && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, segments);
    }

    @Override
    public String toString() {
        return source;
    }
}
