package io.github.typexform.passes.transform;

import io.github.typexform.conf.RunContext;
import io.github.typexform.conf.TransformationTarget;
import io.github.typexform.passes.IRPass;
import io.github.typexform.types.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A pass which replaces every type a target can't represent with a carrier type
 * it can, with a transformation attached that decodes the carrier into the original type.
 * <p>
 * Each type gets its own transformation, so each is replaced in a group of its own.
 */
public class MakeTransformations implements IRPass<TypeGraph, TypeGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MakeTransformations.class);

    /**
     * The tag of the rewrite this pass performs.
     */
    public static final String TAG = "make-transformations";

    private final RunContext ctx;
    private final TransformationTarget target;
    private final ReplaceUnion replaceUnion;
    private final ReplaceArray replaceArray;
    private final ReplaceEnum replaceEnum;
    private final ReplaceTransformedString replaceTransformedString;

    public MakeTransformations(RunContext ctx, TransformationTarget target) {
        this.ctx = ctx;
        this.target = target;
        boolean debug = ctx.isDebugPrintTransformations();
        replaceUnion = new ReplaceUnion(debug);
        replaceArray = new ReplaceArray(debug);
        replaceEnum = new ReplaceEnum(debug);
        replaceTransformedString = new ReplaceTransformedString(debug);
    }

    @Override
    public TypeGraph run(TypeGraph graph) {
        List<Set<Type>> groups = new ArrayList<>();
        for (Type type : graph.allTypesUnordered()) {
            if (target.needsTransformerForType(type)) {
                groups.add(Collections.singleton(type));
            }
        }
        LOGGER.debug("Making transformations for {} types", groups.size());
        return graph.rewrite(
                TAG,
                ctx.getStringTypeMapping(),
                false,
                groups,
                ctx.isDebugPrintReconstitution(),
                this::replace
        );
    }

    private TypeRef replace(Set<Type> group, GraphRewriteBuilder builder, TypeRef forwardingRef) {
        if (group.size() != 1) {
            throw new IllegalStateException("Transformations are made for one type at a time, got " + group);
        }
        Type type = group.iterator().next();
        switch (type.kind) {
            case UNION:
                return replaceUnion.replace((UnionType) type, builder, forwardingRef);
            case ARRAY:
                return replaceArray.replace((ArrayType) type, builder, forwardingRef);
            case ENUM:
                return replaceEnum.replace((EnumType) type, builder, forwardingRef);
            case DATE:
            case TIME:
            case DATE_TIME:
            case UUID:
            case URI:
            case INTEGER_STRING:
            case BOOL_STRING:
                return replaceTransformedString.replace((PrimitiveType) type, builder, forwardingRef);
            default:
                throw new IllegalStateException("Cannot make a transformation for " + type + " of kind " + type.kind);
        }
    }

    @Override
    public String toString() {
        return TAG;
    }
}
