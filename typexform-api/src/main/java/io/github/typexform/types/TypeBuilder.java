package io.github.typexform.types;

import io.github.typexform.attrs.CommonAttributes;
import io.github.typexform.attrs.TypeAttributes;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.IntFunction;

/**
 * Builds a {@link TypeGraph}, deduplicating structurally identical types.
 * <p>
 * Every constructor takes an optional forwarding handle, previously {@link #reserveTypeRef() reserved}.
 * If one is given the constructor returns it, so types that refer to the handle before
 * it is filled end up referring to the constructed type.
 */
public class TypeBuilder {
    private static final int NOT_FORWARDED = -1;

    protected final TypeGraph typeGraph = new TypeGraph();
    private final StringTypeMapping stringTypeMapping;
    private final boolean alphabetizeProperties;

    private final List<Type> types = new ArrayList<>();
    private final List<TypeAttributes> attributes = new ArrayList<>();
    private final List<Integer> forwardedTo = new ArrayList<>();
    private final Map<List<Object>, TypeRef> typeForIdentity = new HashMap<>();
    private final Map<String, TypeRef> topLevels = new LinkedHashMap<>();

    protected boolean lostTypeAttributes = false;
    private boolean finished = false;

    public TypeBuilder(StringTypeMapping stringTypeMapping, boolean alphabetizeProperties) {
        this.stringTypeMapping = stringTypeMapping;
        this.alphabetizeProperties = alphabetizeProperties;
    }

    public TypeBuilder() {
        this(StringTypeMapping.IDENTITY, false);
    }

    public StringTypeMapping getStringTypeMapping() {
        return stringTypeMapping;
    }

    private void checkNotFinished() {
        if (finished) throw new IllegalStateException("Builder is already finished");
    }

    private int checkRef(TypeRef ref) {
        if (ref.serial != typeGraph.serial) {
            throw new IllegalArgumentException("Handle " + ref + " does not belong to the graph being built");
        }
        return ref.index;
    }

    private int resolve(int index) {
        int forward;
        while ((forward = forwardedTo.get(index)) != NOT_FORWARDED) {
            index = forward;
        }
        return index;
    }

    /**
     * Allocate a handle whose slot will be filled later.
     *
     * @return The handle.
     */
    public TypeRef reserveTypeRef() {
        checkNotFinished();
        int index = types.size();
        types.add(null);
        attributes.add(TypeAttributes.EMPTY);
        forwardedTo.add(NOT_FORWARDED);
        return typeGraph.refAt(index);
    }

    public void addTopLevel(String name, TypeRef ref) {
        checkRef(ref);
        if (topLevels.put(name, ref) != null) {
            throw new IllegalArgumentException("Duplicate top level " + name);
        }
    }

    /**
     * Merge attributes into those of an existing, or reserved, type.
     *
     * @param ref        The type.
     * @param attributes The attributes to add.
     */
    public void addAttributes(TypeRef ref, TypeAttributes attributes) {
        int index = resolve(checkRef(ref));
        this.attributes.set(index, this.attributes.get(index).combine(attributes));
    }

    /**
     * Get the handle a handle currently forwards to.
     * A handle that is reserved but not yet filled is its own canonical handle until it is.
     *
     * @param ref The handle.
     * @return The canonical handle.
     */
    public TypeRef canonicalRef(TypeRef ref) {
        return typeGraph.refAt(resolve(checkRef(ref)));
    }

    /**
     * Describe a handle of the graph being built, for diagnostics.
     *
     * @param ref The handle.
     * @return The description.
     */
    public String describe(TypeRef ref) {
        int index = resolve(checkRef(ref));
        Type type = types.get(index);
        return type == null ? "#" + index + " (forwarding)" : type.kind + "#" + index;
    }

    private TypeRef getOrAddType(
            List<Object> identity,
            IntFunction<Type> creator,
            TypeAttributes attrs,
            @Nullable TypeRef forwardingRef
    ) {
        checkNotFinished();
        List<Object> key = new ArrayList<>(identity);
        key.add(attrs.identityAttributes());
        TypeRef existing = typeForIdentity.get(key);
        if (existing != null) {
            addAttributes(existing, attrs.withoutIdentity());
            if (forwardingRef == null) return existing;
            forward(forwardingRef, existing);
            return forwardingRef;
        }
        TypeRef ref = forwardingRef == null ? reserveTypeRef() : forwardingRef;
        int index = checkRef(ref);
        if (types.get(index) != null || forwardedTo.get(index) != NOT_FORWARDED) {
            throw new IllegalStateException("Slot #" + index + " is already filled");
        }
        types.set(index, creator.apply(index));
        addAttributes(ref, attrs);
        typeForIdentity.put(key, ref);
        return ref;
    }

    private void forward(TypeRef from, TypeRef to) {
        int fromIndex = checkRef(from);
        if (types.get(fromIndex) != null || forwardedTo.get(fromIndex) != NOT_FORWARDED) {
            throw new IllegalStateException("Slot #" + fromIndex + " is already filled");
        }
        int toIndex = resolve(checkRef(to));
        if (toIndex == fromIndex) return;
        TypeAttributes pending = attributes.get(fromIndex);
        forwardedTo.set(fromIndex, toIndex);
        attributes.set(fromIndex, TypeAttributes.EMPTY);
        addAttributes(to, pending);
    }

    private Integer identityIndex(TypeRef ref) {
        return resolve(checkRef(ref));
    }

    public TypeRef getPrimitiveType(TypeKind kind) {
        return getPrimitiveType(kind, TypeAttributes.EMPTY, null);
    }

    public TypeRef getPrimitiveType(TypeKind kind, TypeAttributes attrs) {
        return getPrimitiveType(kind, attrs, null);
    }

    /**
     * Get a primitive type. Transformed string kinds are subject to the
     * {@link StringTypeMapping} of this builder.
     *
     * @param kind          The kind.
     * @param attrs         The attributes of the type.
     * @param forwardingRef The handle to place the type at, if any.
     * @return The type.
     */
    public TypeRef getPrimitiveType(TypeKind kind, TypeAttributes attrs, @Nullable TypeRef forwardingRef) {
        if (!kind.isPrimitive()) {
            throw new IllegalArgumentException(kind + " is not a primitive kind");
        }
        kind = stringTypeMapping.get(kind);
        if (kind == TypeKind.STRING) {
            return getStringType(
                    attrs,
                    attrs.getAttribute(CommonAttributes.STRING_TYPES).orElse(StringTypes.UNRESTRICTED),
                    forwardingRef
            );
        }
        TypeKind finalKind = kind;
        return getOrAddType(
                Collections.singletonList(kind),
                index -> new PrimitiveType(typeGraph, index, finalKind),
                attrs,
                forwardingRef
        );
    }

    public TypeRef getStringType(TypeAttributes attrs, StringTypes stringTypes) {
        return getStringType(attrs, stringTypes, null);
    }

    public TypeRef getStringType(TypeAttributes attrs, StringTypes stringTypes, @Nullable TypeRef forwardingRef) {
        return getOrAddType(
                Collections.singletonList(TypeKind.STRING),
                index -> new PrimitiveType(typeGraph, index, TypeKind.STRING),
                attrs.with(CommonAttributes.STRING_TYPES, stringTypes),
                forwardingRef
        );
    }

    public TypeRef getEnumType(TypeAttributes attrs, Collection<String> cases) {
        return getEnumType(attrs, cases, null);
    }

    public TypeRef getEnumType(TypeAttributes attrs, Collection<String> cases, @Nullable TypeRef forwardingRef) {
        return getOrAddType(
                Arrays.asList(TypeKind.ENUM, new TreeSet<>(cases)),
                index -> new EnumType(typeGraph, index, cases),
                attrs,
                forwardingRef
        );
    }

    public TypeRef getArrayType(TypeAttributes attrs, TypeRef items) {
        return getArrayType(attrs, items, null);
    }

    public TypeRef getArrayType(TypeAttributes attrs, TypeRef items, @Nullable TypeRef forwardingRef) {
        return getOrAddType(
                Arrays.asList(TypeKind.ARRAY, identityIndex(items)),
                index -> new ArrayType(typeGraph, index, items),
                attrs,
                forwardingRef
        );
    }

    public TypeRef getMapType(TypeAttributes attrs, TypeRef values) {
        return getMapType(attrs, values, null);
    }

    public TypeRef getMapType(TypeAttributes attrs, TypeRef values, @Nullable TypeRef forwardingRef) {
        return getOrAddType(
                Arrays.asList(TypeKind.MAP, identityIndex(values)),
                index -> new MapType(typeGraph, index, values),
                attrs,
                forwardingRef
        );
    }

    public TypeRef getUnionType(TypeAttributes attrs, Collection<TypeRef> members) {
        return getUnionType(attrs, members, null);
    }

    public TypeRef getUnionType(TypeAttributes attrs, Collection<TypeRef> members, @Nullable TypeRef forwardingRef) {
        Set<Integer> memberIndices = new TreeSet<>();
        for (TypeRef member : members) {
            memberIndices.add(identityIndex(member));
        }
        List<TypeRef> memberList = new ArrayList<>(members);
        return getOrAddType(
                Arrays.asList(TypeKind.UNION, memberIndices),
                index -> new UnionType(typeGraph, index, memberList),
                attrs,
                forwardingRef
        );
    }

    public TypeRef getClassType(TypeAttributes attrs, Map<String, ClassProperty> properties) {
        return getClassType(attrs, properties, null);
    }

    public TypeRef getClassType(
            TypeAttributes attrs,
            Map<String, ClassProperty> properties,
            @Nullable TypeRef forwardingRef
    ) {
        Map<String, ClassProperty> props = alphabetizeProperties
                ? new TreeMap<>(properties)
                : new LinkedHashMap<>(properties);
        Map<String, List<Object>> identity = new TreeMap<>();
        for (Map.Entry<String, ClassProperty> entry : props.entrySet()) {
            ClassProperty property = entry.getValue();
            identity.put(entry.getKey(), Arrays.asList(identityIndex(property.typeRef), property.isOptional));
        }
        return getOrAddType(
                Arrays.asList(TypeKind.CLASS, identity),
                index -> new ClassType(typeGraph, index, props),
                attrs,
                forwardingRef
        );
    }

    /**
     * Finish building, and freeze the graph.
     *
     * @return The graph.
     * @throws IllegalStateException If a reserved handle was never filled, or the graph is malformed.
     */
    public TypeGraph finish() {
        checkNotFinished();
        finished = true;
        int size = types.size();
        int[] canonical = new int[size];
        for (int i = 0; i < size; i++) {
            canonical[i] = resolve(i);
            if (types.get(canonical[i]) == null) {
                throw new IllegalStateException("Slot #" + i + " was reserved but never filled");
            }
        }
        typeGraph.freeze(
                types.toArray(new Type[0]),
                attributes.toArray(new TypeAttributes[0]),
                canonical,
                topLevels,
                lostTypeAttributes
        );
        for (Type type : typeGraph.allTypesUnordered()) {
            if (type instanceof UnionType) {
                // throws if there are two members of a kind
                ((UnionType) type).getMembers();
            }
        }
        return typeGraph;
    }
}
