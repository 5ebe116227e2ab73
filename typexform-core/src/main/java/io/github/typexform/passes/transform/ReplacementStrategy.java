package io.github.typexform.passes.transform;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.Transformation;
import io.github.typexform.transformers.TransformationAttributes;
import io.github.typexform.transformers.Transformer;
import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.Type;
import io.github.typexform.types.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces one type of some kind with a carrier type that has a transformation attached.
 *
 * @param <T> The type of types this replaces.
 */
public abstract class ReplacementStrategy<T extends Type> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReplacementStrategy.class);

    protected final boolean debugPrintTransformations;

    protected ReplacementStrategy(boolean debugPrintTransformations) {
        this.debugPrintTransformations = debugPrintTransformations;
    }

    /**
     * Build the replacement for a type.
     *
     * @param type          The type to replace, in the graph being rewritten.
     * @param builder       The builder of the new graph.
     * @param forwardingRef The handle the replacement must be placed at.
     * @return {@code forwardingRef}.
     */
    public abstract TypeRef replace(T type, GraphRewriteBuilder builder, TypeRef forwardingRef);

    /**
     * Make the attributes that attach a transformation to a carrier type.
     *
     * @param builder       The builder of the new graph.
     * @param targetTypeRef The type the transformation decodes into.
     * @param transformer   The decoding transformer.
     * @return The attributes.
     */
    protected TypeAttributes transformationAttributes(
            GraphRewriteBuilder builder,
            TypeRef targetTypeRef,
            Transformer transformer
    ) {
        Transformation transformation = new Transformation(targetTypeRef, transformer);
        if (debugPrintTransformations) {
            LOGGER.info("transformation for {} in {}:\n{}reverse:\n{}",
                    builder.describe(targetTypeRef),
                    builder.getTag(),
                    transformation.getTransformer().debugPrint(),
                    transformation.getReverse().getTransformer().debugPrint());
        }
        return TransformationAttributes.TRANSFORMATION.makeAttributes(transformation);
    }
}
