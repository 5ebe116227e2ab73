package io.github.typexform.passes;

import io.github.typexform.conf.RunContext;
import io.github.typexform.conf.TransformationTarget;
import io.github.typexform.passes.meta.CheckTransformations;
import io.github.typexform.passes.transform.MakeTransformations;
import io.github.typexform.types.TypeGraph;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Make transformations for a target, and check that they are well-formed.
     *
     * @param ctx    The settings of the run.
     * @param target What the target can't represent.
     * @return The pass.
     */
    public static IRPass<TypeGraph, TypeGraph> makeCheckedTransformations(RunContext ctx, TransformationTarget target) {
        return new MakeTransformations(ctx, target)
                .then(CheckTransformations.INSTANCE);
    }
}
