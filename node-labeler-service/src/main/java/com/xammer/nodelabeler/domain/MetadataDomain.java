package com.xammer.nodelabeler.domain;

/**
 * Kind of node metadata a template renders into. Governs the joiner used for
 * {@code {:all}} and the character rules applied to rendered values.
 */
public enum MetadataDomain {

    LABEL('_'),
    ANNOTATION('/');

    private final char segmentJoiner;

    MetadataDomain(char segmentJoiner) {
        this.segmentJoiner = segmentJoiner;
    }

    public char getSegmentJoiner() {
        return segmentJoiner;
    }
}
