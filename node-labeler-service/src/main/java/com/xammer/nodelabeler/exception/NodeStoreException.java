package com.xammer.nodelabeler.exception;

/**
 * Transient failure talking to the node store. The affected node is retried with backoff.
 */
public class NodeStoreException extends RuntimeException {

    public NodeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
