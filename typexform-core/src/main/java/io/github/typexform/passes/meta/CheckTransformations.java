package io.github.typexform.passes.meta;

import io.github.typexform.passes.InPlaceIRPass;
import io.github.typexform.transformers.Transformation;
import io.github.typexform.transformers.Transformer;
import io.github.typexform.types.Type;
import io.github.typexform.types.TypeGraph;
import io.github.typexform.types.TypeRef;
import io.github.typexform.util.GraphWalker;

import java.util.Map;

/**
 * A pass which checks that the transformations of a graph are well-formed:
 * everything they refer to is in the graph, they decode from the type they are
 * attached to, and they can be reversed.
 */
public class CheckTransformations implements InPlaceIRPass<TypeGraph> {
    /**
     * A singleton instance of this class.
     */
    public static final CheckTransformations INSTANCE = new CheckTransformations();

    @Override
    public void runInPlace(TypeGraph graph) {
        for (Map.Entry<Type, Transformation> entry : CollectTransformations.INSTANCE.run(graph).entrySet()) {
            try {
                check(graph, entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("checking transformation of " + entry.getKey()));
                throw e;
            }
        }
    }

    private static void check(TypeGraph graph, Type carrier, Transformation transformation) {
        graph.typeAt(transformation.getTargetTypeRef());
        checkTransformer(graph, transformation.getTransformer());

        Type source = graph.typeAt(transformation.getSourceTypeRef());
        if (source.kind != carrier.kind) {
            throw new IllegalStateException("Transformation of " + carrier + " decodes from " + source
                    + ", which is of a different kind");
        }

        Transformation reverse = transformation.getReverse();
        if (!graph.canonical(reverse.getSourceTypeRef()).equals(graph.canonical(transformation.getTargetTypeRef()))) {
            throw new IllegalStateException("Reverse of transformation of " + carrier + " does not encode from "
                    + transformation.getTargetTypeRef());
        }
        checkTransformer(graph, reverse.getTransformer());
    }

    private static void checkTransformer(TypeGraph graph, Transformer root) {
        for (Transformer transformer : new GraphWalker<>(root, Transformer::getChildren).toList()) {
            for (TypeRef ref : transformer.getTypeRefs()) {
                // throws if the handle is not from this graph
                graph.typeAt(ref);
            }
        }
    }
}
