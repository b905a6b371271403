package com.example.channeluploader.tree;

/**
 * Raised when a tree or its exchange form breaks a structural rule: nesting deeper than
 * the ceiling, missing keys, or malformed identifiers.
 */
public class TreeFormatException extends IllegalArgumentException {
    public TreeFormatException(String message) {
        super(message);
    }

    public TreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
