package com.xammer.nodelabeler.service;

import com.xammer.nodelabeler.domain.NodeSnapshot;

/**
 * Receives node change events from a {@link NodeStore} watch.
 */
public interface NodeEventListener {

    /** A node was added or changed, or is being re-listed. */
    void onUpsert(NodeSnapshot node);

    void onDelete(String nodeName);

    /** The watch connection reported an error; it may recover on its own. */
    default void onWatchError(Throwable error) {
    }
}
