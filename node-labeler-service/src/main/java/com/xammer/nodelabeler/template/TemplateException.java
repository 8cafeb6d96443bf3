package com.xammer.nodelabeler.template;

/**
 * Raised when a template string cannot be compiled.
 */
public class TemplateException extends RuntimeException {

    public enum Kind {
        UNKNOWN_TOKEN,
        MALFORMED_TEMPLATE
    }

    private final Kind kind;
    private final String template;
    private final int position;

    public TemplateException(Kind kind, String template, int position, String message) {
        super(message + " at position " + position + " in template '" + template + "'");
        this.kind = kind;
        this.template = template;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    public String getTemplate() {
        return template;
    }

    public int getPosition() {
        return position;
    }
}
