package com.xammer.nodelabeler.template;

public enum TokenKind {
    /** {@code {N}}: segment at a zero-based index. */
    INDEX,
    /** {@code {:provider}} */
    PROVIDER,
    /** {@code {:first}} */
    FIRST,
    /** {@code {:last}} */
    LAST,
    /** {@code {:all}}: every segment, joined per domain. */
    ALL
}
