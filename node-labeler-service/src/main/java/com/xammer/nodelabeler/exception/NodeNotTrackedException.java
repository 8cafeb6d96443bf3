package com.xammer.nodelabeler.exception;

public class NodeNotTrackedException extends RuntimeException {

    public NodeNotTrackedException(String nodeName) {
        super("Node not tracked: " + nodeName);
    }
}
