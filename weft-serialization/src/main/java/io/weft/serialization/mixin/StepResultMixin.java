package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;

/// Jackson mixin for `StepResult` that keeps the derived `isFailure()` accessor
/// out of the JSON form; `success` already carries it.
public abstract class StepResultMixin {

    @JsonIgnore
    public abstract boolean isFailure();
}
