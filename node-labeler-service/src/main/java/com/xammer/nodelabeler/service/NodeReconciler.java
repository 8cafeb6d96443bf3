package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.ApplyResult;
import com.xammer.nodelabeler.domain.MetadataPatch;
import com.xammer.nodelabeler.domain.NodeSnapshot;
import com.xammer.nodelabeler.domain.ReconcilePhase;
import com.xammer.nodelabeler.domain.ReconcileTarget;
import com.xammer.nodelabeler.dto.NodeStatusDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Drives one reconcile cycle per node: parse the provider id, render every template,
 * plan a minimal patch and apply it, then arm the node's next run.
 *
 * <p>All per-node state lives in {@link #nodes}, keyed by node name, and is rebuilt from
 * the initial list when the watch starts. At most one cycle runs per node; events that
 * arrive while a cycle is in flight are coalesced into a single follow-up cycle that uses
 * the newest snapshot. Distinct nodes run independently on the scheduler's worker pool.
 */
public class NodeReconciler implements NodeEventListener {

    private static final Logger logger = LoggerFactory.getLogger(NodeReconciler.class);

    private final NodeStore store;
    private final NodeMetadataResolver resolver;
    private final MetadataPlanner planner;
    private final BackoffPolicy backoff;
    private final TaskScheduler scheduler;
    private final ControllerDiagnostics diagnostics;
    private final Clock clock;
    private final Duration requeueInterval;
    private final Duration debounce;

    private final Map<String, NodeEntry> nodes = new ConcurrentHashMap<>();

    public NodeReconciler(NodeStore store, NodeMetadataResolver resolver, MetadataPlanner planner,
            BackoffPolicy backoff, TaskScheduler scheduler, ControllerDiagnostics diagnostics, Clock clock,
            Duration requeueInterval, Duration debounce) {
        this.store = store;
        this.resolver = resolver;
        this.planner = planner;
        this.backoff = backoff;
        this.scheduler = scheduler;
        this.diagnostics = diagnostics;
        this.clock = clock;
        this.requeueInterval = requeueInterval;
        this.debounce = debounce;
    }

    @Override
    public void onUpsert(NodeSnapshot node) {
        diagnostics.recordEvent();
        while (true) {
            NodeEntry entry = nodes.computeIfAbsent(node.getName(), NodeEntry::new);
            synchronized (entry) {
                if (entry.removed) {
                    continue;
                }
                entry.latest = node;
                entry.attempts = 0;
                entry.refetch = false;
                if (entry.inFlight) {
                    entry.rerun = true;
                    logger.debug("Node {} changed during reconcile, queued follow-up", node.getName());
                } else {
                    entry.phase = ReconcilePhase.PENDING;
                    schedule(entry, debounce);
                }
                return;
            }
        }
    }

    @Override
    public void onDelete(String nodeName) {
        diagnostics.recordEvent();
        NodeEntry entry = nodes.remove(nodeName);
        if (entry != null) {
            synchronized (entry) {
                discard(entry);
            }
            logger.debug("Node {} deleted, state discarded", nodeName);
        }
    }

    @Override
    public void onWatchError(Throwable error) {
        diagnostics.recordWatchError();
    }

    /** Cancels every pending timer. In-flight cycles finish without rescheduling. */
    public void shutdown() {
        for (String name : nodes.keySet()) {
            NodeEntry entry = nodes.remove(name);
            if (entry != null) {
                synchronized (entry) {
                    discard(entry);
                }
            }
        }
    }

    public List<NodeStatusDto> status() {
        return nodes.values().stream()
                .map(NodeEntry::toStatus)
                .sorted(Comparator.comparing(NodeStatusDto::getNodeName))
                .collect(Collectors.toList());
    }

    public Optional<NodeStatusDto> status(String nodeName) {
        return Optional.ofNullable(nodes.get(nodeName)).map(NodeEntry::toStatus);
    }

    private void run(NodeEntry entry, long generation) {
        NodeSnapshot snapshot;
        boolean refetch;
        synchronized (entry) {
            // superseded by a later schedule whose timer is still pending
            if (entry.removed || entry.inFlight || generation != entry.generation) {
                return;
            }
            entry.inFlight = true;
            entry.timer = null;
            entry.nextRunAt = null;
            snapshot = entry.latest;
            refetch = entry.refetch;
        }

        Outcome outcome;
        try {
            outcome = reconcile(entry, snapshot, refetch);
        } catch (RuntimeException e) {
            logger.warn("Reconcile of node {} failed: {}", entry.name, e.getMessage());
            logger.debug("Reconcile failure detail for node {}", entry.name, e);
            outcome = Outcome.failed(e.getMessage());
        }

        synchronized (entry) {
            entry.inFlight = false;
            if (entry.removed) {
                return;
            }
            if (entry.rerun) {
                entry.rerun = false;
                entry.phase = ReconcilePhase.PENDING;
                schedule(entry, Duration.ZERO);
                return;
            }
            finish(entry, outcome);
        }
    }

    private Outcome reconcile(NodeEntry entry, NodeSnapshot snapshot, boolean refetch) {
        if (refetch) {
            Optional<NodeSnapshot> fresh = store.get(entry.name);
            if (fresh.isEmpty()) {
                return Outcome.notFound();
            }
            snapshot = fresh.get();
            synchronized (entry) {
                if (!entry.rerun) {
                    entry.latest = snapshot;
                }
            }
        }

        setPhase(entry, ReconcilePhase.EVALUATING);
        logger.debug("Reconciling node {}", entry.name);
        ReconcileTarget target = resolver.resolve(snapshot, clock.instant().plus(requeueInterval));
        if (target.providerId().isEmpty()) {
            logger.warn("No usable provider id on node {} ('{}'), will check again later",
                    entry.name, snapshot.getProviderId());
            return Outcome.skipped(target.getNextRequeueAt());
        }

        MetadataPatch patch = planner.plan(target, snapshot);
        if (patch.isEmpty()) {
            logger.debug("No changes to apply for node {}", entry.name);
            return Outcome.scheduled("up to date", target.getNextRequeueAt());
        }

        setPhase(entry, ReconcilePhase.APPLYING);
        logger.info("Patching node {} labels={} annotations={}", entry.name, patch.getLabels(),
                patch.getAnnotations());
        ApplyResult result = store.applyPatch(patch);
        switch (result) {
            case APPLIED:
                return Outcome.scheduled("patched " + (patch.getLabels().size() + patch.getAnnotations().size())
                        + " key(s)", target.getNextRequeueAt());
            case CONFLICT:
                logger.info("Node {} was modified concurrently, will re-read and retry", entry.name);
                return Outcome.failed("conflict");
            case NOT_FOUND:
                return Outcome.notFound();
            default:
                throw new IllegalStateException("Unhandled apply result " + result);
        }
    }

    // Caller holds the entry lock.
    private void finish(NodeEntry entry, Outcome outcome) {
        if (outcome.gone) {
            logger.info("Node {} no longer exists, dropping it until it is seen again", entry.name);
            nodes.remove(entry.name, entry);
            discard(entry);
            return;
        }
        entry.lastMessage = outcome.message;
        entry.phase = outcome.phase;
        switch (outcome.phase) {
            case SCHEDULED:
            case SKIPPED:
                entry.attempts = 0;
                entry.refetch = false;
                entry.lastSuccess = clock.instant();
                scheduleAt(entry, outcome.requeueAt);
                break;
            case FAILED:
                entry.attempts++;
                entry.refetch = true;
                Duration delay = backoff.delayFor(entry.attempts);
                logger.debug("Retrying node {} in {} (attempt {})", entry.name, delay, entry.attempts);
                schedule(entry, delay);
                break;
            default:
                throw new IllegalStateException("Cycle for node " + entry.name + " ended in " + outcome.phase);
        }
    }

    // Caller holds the entry lock.
    private void schedule(NodeEntry entry, Duration delay) {
        scheduleAt(entry, clock.instant().plus(delay));
    }

    // Caller holds the entry lock.
    private void scheduleAt(NodeEntry entry, Instant at) {
        if (entry.timer != null) {
            entry.timer.cancel(false);
        }
        long generation = ++entry.generation;
        entry.nextRunAt = at;
        entry.timer = scheduler.schedule(() -> run(entry, generation), at);
    }

    // Caller holds the entry lock.
    private static void discard(NodeEntry entry) {
        entry.removed = true;
        entry.generation++;
        if (entry.timer != null) {
            entry.timer.cancel(false);
            entry.timer = null;
        }
        entry.nextRunAt = null;
    }

    private static void setPhase(NodeEntry entry, ReconcilePhase phase) {
        synchronized (entry) {
            entry.phase = phase;
        }
    }

    private static final class NodeEntry {
        private final String name;
        private NodeSnapshot latest;
        private ScheduledFuture<?> timer;
        private Instant nextRunAt;
        private Instant lastSuccess;
        private ReconcilePhase phase = ReconcilePhase.PENDING;
        private String lastMessage;
        private int attempts;
        private long generation;
        private boolean inFlight;
        private boolean rerun;
        private boolean refetch;
        private boolean removed;

        private NodeEntry(String name) {
            this.name = name;
        }

        private synchronized NodeStatusDto toStatus() {
            return NodeStatusDto.builder()
                    .nodeName(name)
                    .providerId(latest == null ? null : latest.getProviderId())
                    .phase(phase)
                    .attempts(attempts)
                    .nextRunAt(nextRunAt)
                    .lastSuccess(lastSuccess)
                    .lastMessage(lastMessage)
                    .build();
        }
    }

    private static final class Outcome {
        private final ReconcilePhase phase;
        private final String message;
        private final boolean gone;
        private final Instant requeueAt;

        private Outcome(ReconcilePhase phase, String message, boolean gone, Instant requeueAt) {
            this.phase = phase;
            this.message = message;
            this.gone = gone;
            this.requeueAt = requeueAt;
        }

        static Outcome scheduled(String message, Instant requeueAt) {
            return new Outcome(ReconcilePhase.SCHEDULED, message, false, requeueAt);
        }

        static Outcome skipped(Instant requeueAt) {
            return new Outcome(ReconcilePhase.SKIPPED, "no usable provider id", false, requeueAt);
        }

        static Outcome failed(String message) {
            return new Outcome(ReconcilePhase.FAILED, message, false, null);
        }

        static Outcome notFound() {
            return new Outcome(ReconcilePhase.FAILED, "node not found", true, null);
        }
    }
}
