package com.hivemind.core.tools;

/**
 * Thrown when a tool name is registered twice.
 */
public class DuplicateToolException extends RuntimeException {

    public DuplicateToolException(String name) {
        super("Tool already registered: " + name);
    }
}
