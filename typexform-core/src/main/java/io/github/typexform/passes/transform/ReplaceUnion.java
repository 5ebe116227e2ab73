package io.github.typexform.passes.transform;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.*;
import io.github.typexform.transformers.DecodingChoiceTransformer.Branch;
import io.github.typexform.types.*;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replaces a union with {@link TypeKind#ANY any}, decoded by dispatching on the runtime
 * kind of the raw value.
 * <p>
 * Transformed string members that stand for another primitive kind are replaced by that
 * kind in the reconstituted union. If that leaves a single member, the union is dropped
 * and decoding produces that member directly.
 */
public class ReplaceUnion extends ReplacementStrategy<UnionType> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReplaceUnion.class);

    public ReplaceUnion(boolean debugPrintTransformations) {
        super(debugPrintTransformations);
    }

    @Override
    public TypeRef replace(UnionType union, GraphRewriteBuilder builder, TypeRef forwardingRef) {
        return new Replacement(union, builder).replace(forwardingRef);
    }

    /**
     * The state of replacing a single union.
     */
    private class Replacement {
        private final UnionType union;
        private final GraphRewriteBuilder builder;
        private final SortedMap<TypeKind, Type> members;
        private final Map<TypeKind, TypeRef> reconstitutedMembers = new EnumMap<>(TypeKind.class);
        // attributes of members that were dropped in favour of their target kind
        private TypeAttributes additionalAttributes = TypeAttributes.EMPTY;
        private boolean haveUnion;
        private @Nullable TypeRef stringType;

        Replacement(UnionType union, GraphRewriteBuilder builder) {
            this.union = union;
            this.builder = builder;
            this.members = union.getMembers();
        }

        TypeRef replace(TypeRef forwardingRef) {
            if (members.isEmpty()) {
                throw new IllegalStateException("Cannot make a transformation for " + union + ", which has no members");
            }
            if (members.containsKey(TypeKind.CLASS) && members.containsKey(TypeKind.MAP)) {
                throw new IllegalStateException("Cannot make a transformation for " + union
                        + ", which has both a class and a map member");
            }

            Set<TypeRef> memberSet = new LinkedHashSet<>();
            for (Type member : members.values()) {
                TypeRef memberRef = builder.canonicalRef(reconstituteMember(member));
                reconstitutedMembers.put(member.kind, memberRef);
                memberSet.add(memberRef);
            }
            haveUnion = memberSet.size() > 1;

            TypeRef targetTypeRef;
            if (haveUnion) {
                targetTypeRef = builder.getUnionType(
                        builder.reconstituteTypeAttributes(union.getAttributes()),
                        memberSet
                );
            } else {
                LOGGER.debug("{} collapses to {} in {}, its attributes are lost",
                        union, builder.describe(memberSet.iterator().next()), builder.getTag());
                builder.setLostTypeAttributes();
                targetTypeRef = memberSet.iterator().next();
            }

            Transformer transformer = new DecodingChoiceTransformer(
                    builder.getPrimitiveType(TypeKind.ANY),
                    branches()
            );
            TypeAttributes attributes = transformationAttributes(builder, targetTypeRef, transformer);
            return builder.getPrimitiveType(
                    TypeKind.ANY,
                    attributes.combine(builder.reconstituteTypeAttributes(additionalAttributes)),
                    forwardingRef
            );
        }

        private TypeRef reconstituteMember(Type member) {
            TypeKind targetKind = member.kind.transformedStringTarget();
            if (targetKind == null) {
                // the string branch matches and parses these itself, so they are rebuilt as they are
                // rather than replaced by a string carrier of their own
                TypeAttributes attributes = builder.reconstituteTypeAttributes(member.getAttributes());
                if (member instanceof EnumType) {
                    return builder.getEnumType(attributes, ((EnumType) member).getCases());
                } else if (member.kind.isTransformedString()) {
                    return builder.getPrimitiveType(member.kind, attributes);
                }
                return builder.reconstituteType(member);
            }
            // the union must hold the target kind, reusing the member of that kind if there is one
            additionalAttributes = additionalAttributes.combine(member.getAttributes());
            Type targetMember = members.get(targetKind);
            if (targetMember != null) {
                return builder.reconstituteType(targetMember);
            }
            return builder.getPrimitiveType(targetKind);
        }

        private Map<Branch, Transformer> branches() {
            Map<Branch, Transformer> branches = new EnumMap<>(Branch.class);
            putBranch(branches, Branch.NULL, TypeKind.NULL);
            putBranch(branches, Branch.INTEGER, TypeKind.INTEGER);
            putBranch(branches, Branch.DOUBLE, TypeKind.DOUBLE);
            putBranch(branches, Branch.BOOL, TypeKind.BOOL);
            Transformer stringTransformer = transformerForStrings();
            if (stringTransformer != null) {
                branches.put(Branch.STRING, stringTransformer);
            }
            putBranch(branches, Branch.ARRAY, TypeKind.ARRAY);
            putBranch(branches, Branch.OBJECT, TypeKind.CLASS);
            putBranch(branches, Branch.OBJECT, TypeKind.MAP);
            return branches;
        }

        private void putBranch(Map<Branch, Transformer> branches, Branch branch, TypeKind kind) {
            if (!members.containsKey(kind)) return;
            TypeRef memberRef = memberRef(kind);
            branches.put(branch, new DecodingTransformer(memberRef, consumer(memberRef)));
        }

        private TypeRef memberRef(TypeKind kind) {
            TypeRef ref = reconstitutedMembers.get(kind);
            if (ref == null) {
                throw new IllegalStateException(union + " has no member of kind " + kind);
            }
            return ref;
        }

        private @Nullable Transformer consumer(TypeRef memberRef) {
            return haveUnion ? new UnionInstantiationTransformer(memberRef) : null;
        }

        private TypeRef getStringType() {
            if (stringType == null) {
                stringType = builder.getStringType(TypeAttributes.EMPTY, StringTypes.UNRESTRICTED);
            }
            return stringType;
        }

        private @Nullable Transformer transformerForStrings() {
            List<Type> stringMembers = union.getStringTypeMembers();
            if (stringMembers.isEmpty()) return null;
            if (stringMembers.size() == 1 || !haveUnion) {
                Type member = stringMembers.get(0);
                TypeRef memberRef = memberRef(member.kind);
                if (member.kind.transformedStringTarget() != null) {
                    return new DecodingTransformer(
                            getStringType(),
                            new ParseStringTransformer(getStringType(), consumer(memberRef))
                    );
                }
                return new DecodingTransformer(memberRef, consumer(memberRef));
            }

            List<Transformer> alternatives = new ArrayList<>();
            for (Type member : stringChoiceOrder(stringMembers)) {
                alternatives.add(transformerForStringMember(member));
            }
            return new DecodingTransformer(
                    getStringType(),
                    new ChoiceTransformer(getStringType(), alternatives)
            );
        }

        private Transformer transformerForStringMember(Type member) {
            TypeRef memberRef = memberRef(member.kind);
            UnionInstantiationTransformer instantiation = new UnionInstantiationTransformer(memberRef);
            if (member.kind == TypeKind.STRING) {
                return instantiation;
            } else if (member instanceof EnumType) {
                return ReplaceEnum.makeEnumTransformer((EnumType) member, getStringType(), instantiation);
            } else {
                return new ParseStringTransformer(getStringType(), instantiation);
            }
        }
    }

    /**
     * Order the string members of a union as they are tried when decoding a string:
     * enums first, then transformed strings in kind order, and plain strings last,
     * since those accept any string.
     *
     * @param stringMembers The string members, in kind order.
     * @return The members, in the order to try them.
     */
    public static List<Type> stringChoiceOrder(List<Type> stringMembers) {
        List<Type> ordered = new ArrayList<>();
        for (Type member : stringMembers) {
            if (member.kind == TypeKind.ENUM) ordered.add(member);
        }
        for (Type member : stringMembers) {
            if (member.kind.isTransformedString()) ordered.add(member);
        }
        for (Type member : stringMembers) {
            if (member.kind == TypeKind.STRING) ordered.add(member);
        }
        return ordered;
    }
}
