package io.weft.core.exception;

import io.weft.core.plan.PlanCreationException;
import java.io.Serial;
import java.util.List;

/// Thrown when the requested tools form a dependency cycle.
///
/// `toolName` is the tool that was reached while still in progress;
/// `cycle` lists the path from that tool back to itself.
public class CircularDependencyException extends PlanCreationException {
    @Serial private static final long serialVersionUID = -1486270853929140563L;

    private final String toolName;
    private final List<String> cycle;

    public CircularDependencyException(String toolName, List<String> cycle) {
        super("Circular dependency detected at tool '" + toolName + "': " + String.join(" -> ", cycle));
        this.toolName = toolName;
        this.cycle = List.copyOf(cycle);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
