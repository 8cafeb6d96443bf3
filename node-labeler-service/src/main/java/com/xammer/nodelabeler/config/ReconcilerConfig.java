package com.xammer.nodelabeler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.nodelabeler.service.BackoffPolicy;
import com.xammer.nodelabeler.service.ControllerDiagnostics;
import com.xammer.nodelabeler.service.Fabric8NodeStore;
import com.xammer.nodelabeler.service.MetadataPlanner;
import com.xammer.nodelabeler.service.NodeMetadataResolver;
import com.xammer.nodelabeler.service.NodeReconciler;
import com.xammer.nodelabeler.service.NodeStore;
import com.xammer.nodelabeler.service.TemplateSpecLoader;
import com.xammer.nodelabeler.service.TemplateSpecRegistry;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the reconcile loop. Template compilation happens here, while the context starts,
 * so a bad entry stops the application before any node is watched.
 */
@Configuration
public class ReconcilerConfig {

    @Bean
    public TemplateSpecRegistry templateSpecRegistry(TemplateSpecLoader loader, LabelerProperties properties) {
        return loader.load(properties.getLabels(), properties.getAnnotations());
    }

    @Bean(name = "reconcilerScheduler")
    public ThreadPoolTaskScheduler reconcilerScheduler(LabelerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getReconciler().getWorkers());
        scheduler.setThreadNamePrefix("Reconciler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public ControllerDiagnostics controllerDiagnostics(Clock clock, LabelerProperties properties) {
        return new ControllerDiagnostics(clock, properties.getHealth().getErrorWindow());
    }

    @Bean
    public NodeStore nodeStore(KubernetesClient client, ObjectMapper objectMapper, LabelerProperties properties) {
        return new Fabric8NodeStore(client, objectMapper, properties.getWatch().getResync().toMillis());
    }

    @Bean
    public NodeReconciler nodeReconciler(NodeStore nodeStore, NodeMetadataResolver resolver, MetadataPlanner planner,
            ThreadPoolTaskScheduler reconcilerScheduler, ControllerDiagnostics diagnostics, Clock clock,
            LabelerProperties properties) {
        BackoffPolicy backoff = new BackoffPolicy(
                properties.getRetry().getInitialBackoff(),
                properties.getRetry().getMaxBackoff(),
                new Random());
        return new NodeReconciler(nodeStore, resolver, planner, backoff, reconcilerScheduler, diagnostics, clock,
                properties.getRequeueInterval(), properties.getReconciler().getDebounce());
    }
}
