package io.weft.cli.commands;

/// Catalog documents shared by the command tests.
final class Catalogs {

    static final String DIGEST =
            """
            {
              "name": "digest",
              "description": "Fetch and summarize",
              "tools": [
                { "name": "fetch", "reliability": 1.0, "cacheEnabled": true,
                  "estimatedDuration": "PT1S", "costPerExecution": 0.01 },
                { "name": "summarize", "dependencies": ["fetch"], "reliability": 1.0,
                  "costPerExecution": 0.01 }
              ],
              "requests": [ { "toolName": "summarize", "input": { "length": 200 } } ]
            }
            """;

    static final String NESTED_INPUT =
            """
            {
              "name": "lookup",
              "tools": [ { "name": "search", "reliability": 1.0, "cacheEnabled": true } ],
              "requests": [
                { "toolName": "search",
                  "input": { "query": { "term": "weft", "filters": ["recent", "docs"] },
                             "limit": 10 } }
              ]
            }
            """;

    static final String BROKEN_FETCH =
            """
            {
              "name": "broken",
              "tools": [
                { "name": "fetch", "reliability": 0.0 },
                { "name": "summarize", "dependencies": ["fetch"], "reliability": 1.0 }
              ],
              "requests": [ { "toolName": "summarize" } ],
              "constraints": { "defaultRetries": 0 }
            }
            """;

    static final String FLAKY =
            """
            {
              "name": "flaky",
              "tools": [
                { "name": "fetch", "reliability": 1.0 },
                { "name": "translate", "dependencies": ["fetch"], "reliability": 0.5 }
              ],
              "requests": [ { "toolName": "translate" } ]
            }
            """;

    static final String SINGLE =
            """
            {
              "name": "single",
              "tools": [ { "name": "ping", "reliability": 1.0 } ],
              "requests": [ { "toolName": "ping" } ]
            }
            """;

    static final String MISSING_DEPENDENCY =
            """
            {
              "name": "orphan",
              "tools": [ { "name": "summarize", "dependencies": ["missing"] } ],
              "requests": [ { "toolName": "summarize" } ]
            }
            """;

    static final String CYCLE =
            """
            {
              "name": "loop",
              "tools": [
                { "name": "a", "dependencies": ["b"] },
                { "name": "b", "dependencies": ["a"] }
              ],
              "requests": [ { "toolName": "a" } ]
            }
            """;

    private Catalogs() {}
}
