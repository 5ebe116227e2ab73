package io.github.typexform.conf;

import io.github.typexform.types.StringTypeMapping;

/**
 * Settings for a run of the transformation passes.
 */
public final class RunContext {
    public static final String DEBUG_PRINT_TRANSFORMATIONS_ENV = "TYPEXFORM_DEBUG_PRINT_TRANSFORMATIONS";
    public static final String DEBUG_PRINT_RECONSTITUTION_ENV = "TYPEXFORM_DEBUG_PRINT_RECONSTITUTION";

    public static final RunContext DEFAULT = builder().build();

    private final boolean debugPrintTransformations;
    private final boolean debugPrintReconstitution;
    private final StringTypeMapping stringTypeMapping;

    private RunContext(Builder builder) {
        debugPrintTransformations = builder.debugPrintTransformations;
        debugPrintReconstitution = builder.debugPrintReconstitution;
        stringTypeMapping = builder.stringTypeMapping;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get a context with the debug flags taken from the environment.
     * A flag is on if its variable is set at all.
     *
     * @return The context.
     */
    public static RunContext fromEnvironment() {
        return builder()
                .setDebugPrintTransformations(System.getenv(DEBUG_PRINT_TRANSFORMATIONS_ENV) != null)
                .setDebugPrintReconstitution(System.getenv(DEBUG_PRINT_RECONSTITUTION_ENV) != null)
                .build();
    }

    public boolean isDebugPrintTransformations() {
        return debugPrintTransformations;
    }

    public boolean isDebugPrintReconstitution() {
        return debugPrintReconstitution;
    }

    public StringTypeMapping getStringTypeMapping() {
        return stringTypeMapping;
    }

    public Builder toBuilder() {
        return builder()
                .setDebugPrintTransformations(debugPrintTransformations)
                .setDebugPrintReconstitution(debugPrintReconstitution)
                .setStringTypeMapping(stringTypeMapping);
    }

    public static class Builder {
        private boolean debugPrintTransformations = false;
        private boolean debugPrintReconstitution = false;
        private StringTypeMapping stringTypeMapping = StringTypeMapping.IDENTITY;

        public Builder setDebugPrintTransformations(boolean debugPrintTransformations) {
            this.debugPrintTransformations = debugPrintTransformations;
            return this;
        }

        public Builder setDebugPrintReconstitution(boolean debugPrintReconstitution) {
            this.debugPrintReconstitution = debugPrintReconstitution;
            return this;
        }

        public Builder setStringTypeMapping(StringTypeMapping stringTypeMapping) {
            this.stringTypeMapping = stringTypeMapping;
            return this;
        }

        public RunContext build() {
            return new RunContext(this);
        }
    }
}
