package io.github.typexform.types;

import io.github.typexform.attrs.TypeAttributes;

import java.util.*;

/**
 * A {@link TypeBuilder} that builds a new graph out of an existing one.
 * <p>
 * Old types are {@link #reconstituteType(Type) reconstituted} on demand, starting from the
 * top levels. Each old type is reconstituted at most once: a forwarding handle is reserved
 * and remembered before its body is rebuilt (or its replacement built), so types that
 * refer back to it get that handle.
 */
public class GraphRewriteBuilder extends TypeBuilder {
    /**
     * Builds the replacement for a group of types.
     */
    @FunctionalInterface
    public interface Replacer {
        /**
         * Build the replacement for a group of types.
         *
         * @param group         The old types to replace.
         * @param builder       The builder of the new graph.
         * @param forwardingRef The handle the replacement must be placed at.
         * @return {@code forwardingRef}.
         */
        TypeRef replace(Set<Type> group, GraphRewriteBuilder builder, TypeRef forwardingRef);
    }

    private final TypeGraph originalGraph;
    private final String tag;
    private final Replacer replacer;
    private final Map<Type, Set<Type>> groupForType = new HashMap<>();
    private final Map<Type, TypeRef> reconstitutedTypes = new HashMap<>();

    GraphRewriteBuilder(
            TypeGraph originalGraph,
            String tag,
            StringTypeMapping stringTypeMapping,
            boolean alphabetizeProperties,
            Collection<? extends Set<Type>> replacementGroups,
            Replacer replacer
    ) {
        super(stringTypeMapping, alphabetizeProperties);
        this.originalGraph = originalGraph;
        this.tag = tag;
        this.replacer = replacer;
        for (Set<Type> group : replacementGroups) {
            if (group.isEmpty()) {
                throw new IllegalArgumentException("Empty replacement group in " + tag);
            }
            Set<Type> frozenGroup = Collections.unmodifiableSet(new LinkedHashSet<>(group));
            for (Type type : group) {
                checkOriginal(type);
                if (groupForType.put(type, frozenGroup) != null) {
                    throw new IllegalArgumentException(type + " is in more than one replacement group in " + tag);
                }
            }
        }
    }

    private void checkOriginal(Type type) {
        if (type.graph != originalGraph) {
            throw new IllegalArgumentException(type + " is not from the graph being rewritten");
        }
    }

    public String getTag() {
        return tag;
    }

    /**
     * Get the type in the new graph that stands for an old type, building it if necessary.
     *
     * @param oldType The type in the graph being rewritten.
     * @return The handle of its counterpart in the new graph.
     */
    public TypeRef reconstituteType(Type oldType) {
        checkOriginal(oldType);
        TypeRef existing = reconstitutedTypes.get(oldType);
        if (existing != null) return existing;

        TypeRef forwardingRef = reserveTypeRef();
        Set<Type> group = groupForType.get(oldType);
        TypeRef result;
        if (group == null) {
            reconstitutedTypes.put(oldType, forwardingRef);
            result = oldType.reconstitute(this, forwardingRef);
        } else {
            for (Type member : group) {
                reconstitutedTypes.put(member, forwardingRef);
            }
            try {
                result = replacer.replace(group, this, forwardingRef);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("replacing " + oldType + " in " + tag));
                throw e;
            }
        }
        if (!result.equals(forwardingRef)) {
            throw new IllegalStateException(
                    "Replacement for " + oldType + " in " + tag + " was not placed at its forwarding handle " + forwardingRef);
        }
        return result;
    }

    public TypeRef reconstituteTypeRef(TypeRef oldRef) {
        return reconstituteType(originalGraph.typeAt(oldRef));
    }

    public TypeAttributes reconstituteTypeAttributes(TypeAttributes attributes) {
        return attributes.reconstitute(this);
    }

    /**
     * Flag that attributes of some old type could not be carried into the new graph.
     */
    public void setLostTypeAttributes() {
        lostTypeAttributes = true;
    }

    public boolean hasLostTypeAttributes() {
        return lostTypeAttributes;
    }

    @Override
    public TypeGraph finish() {
        for (Map.Entry<String, Type> entry : originalGraph.topLevels().entrySet()) {
            addTopLevel(entry.getKey(), reconstituteType(entry.getValue()));
        }
        return super.finish();
    }
}
