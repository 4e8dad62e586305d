package com.d2stacks.core.model;

import java.util.List;

/**
 * A successful outcome that may carry non-fatal warnings, e.g. a stack created
 * whose permissions could not be applied.
 */
public record MaybeWarnings<T>(T data, List<String> warnings) {

    public MaybeWarnings {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static <T> MaybeWarnings<T> of(T data) {
        return new MaybeWarnings<>(data, List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
