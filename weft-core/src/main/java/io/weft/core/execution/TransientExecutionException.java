package io.weft.core.execution;

import java.io.Serial;

/// A retryable tool failure: timeouts, network errors, temporary unavailability.
public class TransientExecutionException extends ToolExecutionException {

    @Serial private static final long serialVersionUID = -8210390716128848417L;

    public TransientExecutionException(String toolName, FailureKind kind, String message) {
        super(toolName, kind, message, null);
    }

    public TransientExecutionException(
            String toolName, FailureKind kind, String message, Throwable cause) {
        super(toolName, kind, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
