package com.chainflow.chainflow_backend.model.context;

/**
 * Node output that travels only along edges leaving the named handle.
 */
public record RoutedOutput(String handle, Object value) {

    public static final String TRUE_HANDLE  = "true";
    public static final String FALSE_HANDLE = "false";

    public static RoutedOutput of(boolean condition, Object value) {
        return new RoutedOutput(condition ? TRUE_HANDLE : FALSE_HANDLE, value);
    }

    /** Accepts "true", "trueHandle" and the editor's "<nodeId>-source-true" forms. */
    public boolean matches(String sourceHandle) {
        if (sourceHandle == null || sourceHandle.isBlank()) return false;
        String h = sourceHandle.trim();
        return h.equalsIgnoreCase(handle)
                || h.equalsIgnoreCase(handle + "Handle")
                || h.endsWith("-source-" + handle);
    }
}
