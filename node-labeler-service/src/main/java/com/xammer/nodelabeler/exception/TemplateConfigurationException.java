package com.xammer.nodelabeler.exception;

import java.util.List;

/**
 * Thrown at startup when one or more configured label or annotation entries are invalid.
 * Carries every problem found, not just the first.
 */
public class TemplateConfigurationException extends RuntimeException {

    private final List<String> errors;

    public TemplateConfigurationException(List<String> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(List<String> errors) {
        StringBuilder sb = new StringBuilder("Invalid metadata template configuration (")
                .append(errors.size())
                .append(errors.size() == 1 ? " error)" : " errors)");
        for (String error : errors) {
            sb.append(System.lineSeparator()).append("  - ").append(error);
        }
        return sb.toString();
    }
}
