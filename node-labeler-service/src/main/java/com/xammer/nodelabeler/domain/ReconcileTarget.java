package com.xammer.nodelabeler.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working state of a single reconcile cycle. Discarded when the cycle ends.
 */
@Getter
@Builder
@ToString
public final class ReconcileTarget {

    private final String nodeName;
    private final ProviderId providerId;
    @Singular
    private final Map<String, String> desiredLabels;
    @Singular
    private final Map<String, String> desiredAnnotations;
    @Singular
    private final Set<String> skippedKeys;
    private final Instant nextRequeueAt;

    public Optional<ProviderId> providerId() {
        return Optional.ofNullable(providerId);
    }
}
