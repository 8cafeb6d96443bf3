package com.xammer.nodelabeler.domain;

import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a node's {@code spec.providerID}:
 * {@code <provider>://<seg0>/<seg1>/.../<segN>}.
 */
public final class ProviderId {

    private final String raw;
    private final String provider;
    private final List<String> segments;

    public ProviderId(String raw, String provider, List<String> segments) {
        if (provider == null || provider.isEmpty()) {
            throw new IllegalArgumentException("provider must not be empty");
        }
        this.raw = Objects.requireNonNull(raw, "raw");
        this.provider = provider;
        this.segments = List.copyOf(segments);
    }

    public String getRaw() {
        return raw;
    }

    public String getProvider() {
        return provider;
    }

    public List<String> getSegments() {
        return segments;
    }

    public int segmentCount() {
        return segments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProviderId)) return false;
        ProviderId that = (ProviderId) o;
        return raw.equals(that.raw) && provider.equals(that.provider) && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(raw, provider, segments);
    }

    @Override
    public String toString() {
        return raw;
    }
}
