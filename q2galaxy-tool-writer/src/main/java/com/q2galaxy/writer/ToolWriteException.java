package com.q2galaxy.writer;

/**
 * A tool document could not be serialized: the tree holds content XML cannot represent, or the XML writer failed.
 */
public class ToolWriteException extends RuntimeException {

    public ToolWriteException(String message) {
        super(message);
    }

    public ToolWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
