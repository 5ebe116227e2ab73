package io.github.typexform.test;

import io.github.typexform.conf.RunContext;
import io.github.typexform.conf.TransformationTarget;
import io.github.typexform.passes.IRPass;
import io.github.typexform.passes.Passes;
import io.github.typexform.transformers.Transformation;
import io.github.typexform.transformers.TransformationAttributes;
import io.github.typexform.types.Type;
import io.github.typexform.types.TypeGraph;
import io.github.typexform.types.TypeKind;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public class Utils {
    public static final RunContext DEBUG = RunContext.builder()
            .setDebugPrintTransformations(true)
            .setDebugPrintReconstitution(true)
            .build();

    public static TransformationTarget kinds(TypeKind... kinds) {
        Set<TypeKind> set = EnumSet.noneOf(TypeKind.class);
        set.addAll(Arrays.asList(kinds));
        return type -> set.contains(type.kind);
    }

    public static IRPass<TypeGraph, TypeGraph> pass(TypeKind... kinds) {
        return Passes.makeCheckedTransformations(DEBUG, kinds(kinds));
    }

    public static Transformation transformationOf(Type type) {
        return type.getAttributes().getOrThrow(TransformationAttributes.TRANSFORMATION);
    }
}
