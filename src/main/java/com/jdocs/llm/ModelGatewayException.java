package com.jdocs.llm;

import java.io.IOException;

/**
 * The completion endpoint could not be reached or answered with something unusable.
 */
public class ModelGatewayException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public ModelGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ModelGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
