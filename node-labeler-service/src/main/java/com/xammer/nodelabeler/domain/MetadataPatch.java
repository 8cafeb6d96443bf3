package com.xammer.nodelabeler.domain;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Minimal metadata delta for one node. Only keys whose value must change are present;
 * nothing is ever removed. {@code resourceVersion} is the version the delta was planned
 * against and guards the write.
 */
public final class MetadataPatch {

    private final String nodeName;
    private final String resourceVersion;
    private final SortedMap<String, String> labels;
    private final SortedMap<String, String> annotations;

    public MetadataPatch(String nodeName, String resourceVersion,
            Map<String, String> labels, Map<String, String> annotations) {
        this.nodeName = Objects.requireNonNull(nodeName, "nodeName");
        this.resourceVersion = resourceVersion;
        this.labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels));
        this.annotations = Collections.unmodifiableSortedMap(new TreeMap<>(annotations));
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getResourceVersion() {
        return resourceVersion;
    }

    public SortedMap<String, String> getLabels() {
        return labels;
    }

    public SortedMap<String, String> getAnnotations() {
        return annotations;
    }

    public boolean isEmpty() {
        return labels.isEmpty() && annotations.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataPatch)) return false;
        MetadataPatch that = (MetadataPatch) o;
        return nodeName.equals(that.nodeName)
                && Objects.equals(resourceVersion, that.resourceVersion)
                && labels.equals(that.labels)
                && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeName, resourceVersion, labels, annotations);
    }

    @Override
    public String toString() {
        return "MetadataPatch{node=" + nodeName + ", resourceVersion=" + resourceVersion
                + ", labels=" + labels + ", annotations=" + annotations + "}";
    }
}
