package com.xammer.nodelabeler.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;

/**
 * Point-in-time view of the node fields the controller reads.
 */
@Getter
@ToString
public final class NodeSnapshot {

    private final String name;
    private final String resourceVersion;
    private final String providerId;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;

    @Builder
    public NodeSnapshot(String name, String resourceVersion, String providerId,
            Map<String, String> labels, Map<String, String> annotations) {
        this.name = name;
        this.resourceVersion = resourceVersion;
        this.providerId = providerId;
        this.labels = labels == null ? Collections.emptyMap() : Map.copyOf(labels);
        this.annotations = annotations == null ? Collections.emptyMap() : Map.copyOf(annotations);
    }
}
