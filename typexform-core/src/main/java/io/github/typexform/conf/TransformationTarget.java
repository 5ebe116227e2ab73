package io.github.typexform.conf;

import io.github.typexform.types.Type;

/**
 * What a renderer can't represent directly.
 */
@FunctionalInterface
public interface TransformationTarget {
    /**
     * Whether the renderer needs a transformation to handle values of the given type.
     * <p>
     * Only unions, arrays, enums and transformed string types may be selected.
     *
     * @param type The type.
     * @return Whether the type should be replaced by a carrier with a transformation.
     */
    boolean needsTransformerForType(Type type);
}
