package com.jdocs.tools;

/**
 * A tool provider operation failed: unknown tool or prompt, invalid arguments,
 * an error raised by the tool itself, or a broken connection to the provider.
 */
public class ToolExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
