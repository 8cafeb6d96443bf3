package com.xammer.nodelabeler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;

/**
 * Starts the node watch once the application is up and stops it on shutdown.
 */
@Service
public class NodeWatchService {

    private static final Logger logger = LoggerFactory.getLogger(NodeWatchService.class);

    private final NodeStore nodeStore;
    private final NodeReconciler reconciler;
    private final ControllerDiagnostics diagnostics;
    private final TemplateSpecRegistry specs;

    public NodeWatchService(NodeStore nodeStore, NodeReconciler reconciler, ControllerDiagnostics diagnostics,
            TemplateSpecRegistry specs) {
        this.nodeStore = nodeStore;
        this.reconciler = reconciler;
        this.diagnostics = diagnostics;
        this.specs = specs;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        logger.info("Starting node controller with {} template(s)", specs.size());
        nodeStore.watch(reconciler);
        diagnostics.markReady();
        logger.info("Node controller ready");
    }

    @PreDestroy
    public void stop() {
        logger.info("Stopping node controller");
        diagnostics.markNotReady();
        nodeStore.close();
        reconciler.shutdown();
    }
}
