package io.weft.core.execution.cache;

import java.util.Map;

/// Derives the cache key of a tool invocation.
///
/// ### Contracts
/// - **Postcondition**: the key is a pure function of `toolName` and the
///   *content* of `input`; maps with equal entries in a different insertion order
///   produce the same key
///
/// @see CanonicalCacheKeyStrategy for the dependency-free default
@FunctionalInterface
public interface CacheKeyStrategy {

    /// Computes the key for an invocation.
    ///
    /// @param toolName tool identifier, not null
    /// @param input invocation input, not null
    /// @return cache key, never null
    String key(String toolName, Map<String, Object> input);
}
