package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.ApplyResult;
import com.xammer.nodelabeler.domain.MetadataPatch;
import com.xammer.nodelabeler.domain.NodeSnapshot;

import java.util.Optional;

/**
 * Source of node state and target of metadata patches.
 *
 * <p>Transient failures are thrown as {@link com.xammer.nodelabeler.exception.NodeStoreException}.
 */
public interface NodeStore {

    /**
     * Subscribes to node changes. Returns once every existing node has been delivered.
     */
    void watch(NodeEventListener listener);

    /** Fresh read of a node, bypassing any cache. */
    Optional<NodeSnapshot> get(String nodeName);

    /**
     * Merges the patch into the node's metadata. Returns {@link ApplyResult#CONFLICT} when the
     * node's resource version no longer matches the patch.
     */
    ApplyResult applyPatch(MetadataPatch patch);

    /** Stops the watch. */
    void close();
}
