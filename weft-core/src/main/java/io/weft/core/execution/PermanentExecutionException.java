package io.weft.core.execution;

import java.io.Serial;

/// A tool failure that is never retried, regardless of remaining attempts.
public class PermanentExecutionException extends ToolExecutionException {

    @Serial private static final long serialVersionUID = 5046615394370925370L;

    public PermanentExecutionException(String toolName, String message) {
        super(toolName, FailureKind.INTERNAL, message, null);
    }

    public PermanentExecutionException(String toolName, FailureKind kind, String message) {
        super(toolName, kind, message, null);
    }

    public PermanentExecutionException(
            String toolName, FailureKind kind, String message, Throwable cause) {
        super(toolName, kind, message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
