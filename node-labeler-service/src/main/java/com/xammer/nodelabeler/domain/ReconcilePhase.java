package com.xammer.nodelabeler.domain;

/**
 * Per-node reconcile phases. {@code SCHEDULED}, {@code SKIPPED} and {@code FAILED}
 * end a cycle; the first two arm the periodic re-check, {@code FAILED} arms a backoff retry.
 */
public enum ReconcilePhase {
    PENDING,
    EVALUATING,
    APPLYING,
    SCHEDULED,
    FAILED,
    SKIPPED
}
