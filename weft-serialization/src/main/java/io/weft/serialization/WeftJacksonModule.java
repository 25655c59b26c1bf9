package io.weft.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.weft.core.execution.StepResult;
import io.weft.core.plan.PlanConstraints;
import io.weft.core.tool.ToolDefinition;
import io.weft.serialization.mixin.StepResultMixin;
import io.weft.serialization.mixin.ToolDefinitionBuilderMixin;
import io.weft.serialization.mixin.ToolDefinitionMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Weft serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom deserializer** (records whose missing fields need domain defaults rather
/// than Java zero values):
/// - `PlanConstraints` via `PlanConstraintsDeserializer`
///
/// **Mixins**:
/// - `ToolDefinition` + `ToolDefinition.Builder`, so catalogs may omit any field
///   the builder defaults
/// - `StepResult`, hiding the derived `isFailure()` accessor
///
/// Every other domain type is a plain record and binds through its canonical
/// constructor.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see WeftSerializer for the convenience factory API
public class WeftJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127785913370526811L;

    public WeftJacksonModule() {
        super("WeftJacksonModule");

        addDeserializer(PlanConstraints.class, new PlanConstraintsDeserializer());
    }

    /// Applies mixin annotations to builder-pattern and record domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ToolDefinition.class, ToolDefinitionMixin.class);
        context.setMixInAnnotations(ToolDefinition.Builder.class, ToolDefinitionBuilderMixin.class);

        context.setMixInAnnotations(StepResult.class, StepResultMixin.class);
    }
}
