package io.github.typexform.passes.transform;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.*;
import io.github.typexform.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Replaces an enum with an unrestricted string, matched against each of the enum's cases.
 */
public class ReplaceEnum extends ReplacementStrategy<EnumType> {
    public ReplaceEnum(boolean debugPrintTransformations) {
        super(debugPrintTransformations);
    }

    @Override
    public TypeRef replace(EnumType enumType, GraphRewriteBuilder builder, TypeRef forwardingRef) {
        TypeRef stringType = builder.getStringType(TypeAttributes.EMPTY, StringTypes.UNRESTRICTED);
        Transformer transformer = new DecodingTransformer(
                stringType,
                makeEnumTransformer(enumType, stringType, null)
        );
        TypeRef reconstitutedEnum = builder.getEnumType(
                builder.reconstituteTypeAttributes(enumType.getAttributes()),
                enumType.getCases()
        );
        TypeAttributes attributes = transformationAttributes(builder, reconstitutedEnum, transformer);
        return builder.getStringType(attributes, StringTypes.UNRESTRICTED, forwardingRef);
    }

    /**
     * Make a choice over the cases of an enum, in lexicographic order. Each alternative
     * matches the string of one case and produces that case.
     *
     * @param enumType     The enum.
     * @param stringType   The string type the cases are matched against.
     * @param continuation What to run on the matched case, if anything.
     * @return The transformer.
     */
    public static Transformer makeEnumTransformer(
            EnumType enumType,
            TypeRef stringType,
            @Nullable Transformer continuation
    ) {
        if (enumType.getCases().isEmpty()) {
            throw new IllegalStateException("Cannot make a transformer for " + enumType + ", which has no cases");
        }
        List<Transformer> caseTransformers = new ArrayList<>();
        for (String enumCase : new TreeSet<>(enumType.getCases())) {
            caseTransformers.add(new StringMatchTransformer(
                    stringType,
                    new StringProducerTransformer(stringType, continuation, enumCase),
                    enumCase
            ));
        }
        return new ChoiceTransformer(stringType, caseTransformers);
    }
}
