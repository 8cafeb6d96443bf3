package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.MetadataPatch;
import com.xammer.nodelabeler.domain.NodeSnapshot;
import com.xammer.nodelabeler.domain.ReconcileTarget;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Diffs desired metadata against a node's current metadata.
 *
 * <p>The patch holds only keys whose value differs. Keys absent from the desired maps,
 * including skipped ones, are never touched.
 */
@Component
public class MetadataPlanner {

    public MetadataPatch plan(ReconcileTarget target, NodeSnapshot current) {
        return new MetadataPatch(
                current.getName(),
                current.getResourceVersion(),
                delta(target.getDesiredLabels(), current.getLabels()),
                delta(target.getDesiredAnnotations(), current.getAnnotations()));
    }

    private static Map<String, String> delta(Map<String, String> desired, Map<String, String> current) {
        Map<String, String> delta = new TreeMap<>();
        desired.forEach((key, value) -> {
            if (!value.equals(current.get(key))) {
                delta.put(key, value);
            }
        });
        return delta;
    }
}
