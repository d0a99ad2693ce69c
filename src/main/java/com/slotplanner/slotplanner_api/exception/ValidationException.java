package com.slotplanner.slotplanner_api.exception;

import java.util.List;

/**
 * Structurally invalid planning input. Carries every problem found, not just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super(summarize(errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String summarize(List<String> errors) {
        if (errors.size() == 1) return "Invalid planning input: " + errors.get(0);
        return "Invalid planning input: " + errors.size() + " problems found.";
    }
}
