package io.weft.core.tool;

/// Functional category of a registered tool.
///
/// Categories are descriptive only; scheduling never depends on them. They are
/// carried through plans and catalogs so reports can group tools.
public enum ToolCategory {
    PLANNING,
    GENERATION,
    ANALYSIS,
    TRANSFORMATION,
    VALIDATION,
    ORCHESTRATION
}
