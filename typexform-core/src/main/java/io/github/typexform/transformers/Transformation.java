package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import io.github.typexform.util.Lazy;

/**
 * A transformer together with the type it produces.
 * <p>
 * A transformation is attached to exactly one type, the one whose values it decodes,
 * under {@link TransformationAttributes#TRANSFORMATION}. Its {@link #getReverse() reverse}
 * encodes values of the target type back into that type.
 */
public final class Transformation {
    private final TypeRef targetTypeRef;
    private final Transformer transformer;
    private final Lazy<Transformation> reverse;

    public Transformation(TypeRef targetTypeRef, Transformer transformer) {
        this.targetTypeRef = targetTypeRef;
        this.transformer = transformer;
        this.reverse = Lazy.lazy(() -> new Transformation(
                transformer.sourceTypeRef,
                transformer.reverse(targetTypeRef, null)
        ));
    }

    public TypeRef getTargetTypeRef() {
        return targetTypeRef;
    }

    public TypeRef getSourceTypeRef() {
        return transformer.sourceTypeRef;
    }

    public Transformer getTransformer() {
        return transformer;
    }

    /**
     * Get the transformation that undoes this one. It is computed on first use, once.
     *
     * @return The reverse transformation.
     */
    public Transformation getReverse() {
        return reverse.get();
    }

    public Transformation reconstitute(GraphRewriteBuilder builder) {
        return new Transformation(builder.reconstituteTypeRef(targetTypeRef), transformer.reconstitute(builder));
    }

    public String debugPrint() {
        return "transformation to " + targetTypeRef + ":\n" + transformer.debugPrint();
    }

    @Override
    public String toString() {
        return "transformation to " + targetTypeRef + " from " + transformer;
    }
}
