package io.github.typexform.transformers;

import io.github.typexform.attrs.TypeAttributeKind;
import io.github.typexform.types.GraphRewriteBuilder;

public class TransformationAttributes {
    /**
     * The transformation that decodes values of a type.
     * <p>
     * Part of type identity, since a type with a transformation is represented differently
     * from one without. A type has at most one transformation.
     */
    public static final TypeAttributeKind<Transformation> TRANSFORMATION = new TransformationKind();

    private static class TransformationKind extends TypeAttributeKind<Transformation> {
        TransformationKind() {
            super(Transformation.class, "transformation", TransformationKind::cannotCombine, true);
        }

        private static Transformation cannotCombine(Transformation lhs, Transformation rhs) {
            throw new IllegalStateException("A type cannot have more than one transformation: " + lhs + ", " + rhs);
        }

        @Override
        public Transformation reconstitute(GraphRewriteBuilder builder, Transformation value) {
            return value.reconstitute(builder);
        }
    }
}
