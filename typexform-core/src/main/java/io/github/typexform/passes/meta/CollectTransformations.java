package io.github.typexform.passes.meta;

import io.github.typexform.passes.IRPass;
import io.github.typexform.transformers.Transformation;
import io.github.typexform.transformers.TransformationAttributes;
import io.github.typexform.types.Type;
import io.github.typexform.types.TypeGraph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A pass which collects the transformation of every type of a graph that has one,
 * in slot order.
 */
public class CollectTransformations implements IRPass<TypeGraph, Map<Type, Transformation>> {
    /**
     * A singleton instance of this class.
     */
    public static final CollectTransformations INSTANCE = new CollectTransformations();

    @Override
    public Map<Type, Transformation> run(TypeGraph graph) {
        Map<Type, Transformation> transformations = new LinkedHashMap<>();
        for (Type type : graph.allTypesUnordered()) {
            type.getAttributes()
                    .getAttribute(TransformationAttributes.TRANSFORMATION)
                    .ifPresent(transformation -> transformations.put(type, transformation));
        }
        return transformations;
    }
}
