package io.weft.core.exception;

import io.weft.core.plan.PlanCreationException;
import java.io.Serial;

public class ToolNotFoundException extends PlanCreationException {
    @Serial private static final long serialVersionUID = 7796003563480211657L;

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool not found in registry: " + toolName);
        this.toolName = toolName;
    }

    public ToolNotFoundException(String toolName, String requiredBy) {
        super("Tool not found in registry: " + toolName + " (required by " + requiredBy + ")");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
