package com.xammer.nodelabeler.template;

/**
 * Raised when a compiled template cannot produce a value for a node. The key is
 * skipped for the current cycle; other keys are unaffected.
 */
public class EvaluationException extends RuntimeException {

    public enum Kind {
        MISSING_PROVIDER_ID,
        INDEX_OUT_OF_RANGE,
        INVALID_LABEL_VALUE
    }

    private final Kind kind;

    public EvaluationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
