package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.MetadataDomain;
import com.xammer.nodelabeler.domain.NodeSnapshot;
import com.xammer.nodelabeler.domain.ProviderId;
import com.xammer.nodelabeler.domain.ReconcileTarget;
import com.xammer.nodelabeler.domain.TemplateSpec;
import com.xammer.nodelabeler.template.EvaluationException;
import com.xammer.nodelabeler.template.TemplateEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Evaluates every configured template for one node snapshot.
 */
@Component
public class NodeMetadataResolver {

    private static final Logger logger = LoggerFactory.getLogger(NodeMetadataResolver.class);

    private final TemplateSpecRegistry specs;
    private final ProviderIdParser parser;
    private final TemplateEvaluator evaluator;

    public NodeMetadataResolver(TemplateSpecRegistry specs, ProviderIdParser parser, TemplateEvaluator evaluator) {
        this.specs = specs;
        this.parser = parser;
        this.evaluator = evaluator;
    }

    /**
     * Builds the desired metadata for a node. Keys whose template cannot be rendered are
     * recorded as skipped and left out of the desired maps.
     */
    public ReconcileTarget resolve(NodeSnapshot node, Instant nextRequeueAt) {
        ProviderId providerId = parser.parse(node.getProviderId()).orElse(null);
        ReconcileTarget.ReconcileTargetBuilder target = ReconcileTarget.builder()
                .nodeName(node.getName())
                .providerId(providerId)
                .nextRequeueAt(nextRequeueAt);

        for (TemplateSpec spec : specs) {
            String key = spec.getKey().toString();
            try {
                String value = evaluator.evaluate(spec.getTemplate(), providerId, spec.getDomain());
                if (spec.getDomain() == MetadataDomain.LABEL) {
                    target.desiredLabel(key, value);
                } else {
                    target.desiredAnnotation(key, value);
                }
            } catch (EvaluationException e) {
                target.skippedKey(key);
                if (providerId != null) {
                    logger.warn("Skipping {} '{}' on node {}: {}", spec.getDomain().name().toLowerCase(), key,
                            node.getName(), e.getMessage());
                }
            }
        }
        return target.build();
    }
}
