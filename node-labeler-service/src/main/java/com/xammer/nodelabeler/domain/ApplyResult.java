package com.xammer.nodelabeler.domain;

public enum ApplyResult {
    APPLIED,
    /** The node changed since it was read; re-read and retry. */
    CONFLICT,
    NOT_FOUND
}
