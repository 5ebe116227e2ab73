package io.github.typexform.types;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.util.GraphWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A frozen graph of types, built by a {@link TypeBuilder}.
 * <p>
 * Types live in numbered slots. A slot is either a type, or forwards to another
 * slot that holds a structurally identical type; {@link #typeAt(TypeRef)} and
 * {@link #canonical(TypeRef)} resolve such forwarding.
 */
public final class TypeGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeGraph.class);
    private static final AtomicInteger SERIAL_COUNTER = new AtomicInteger(0);

    final int serial = SERIAL_COUNTER.getAndIncrement();

    private boolean frozen = false;
    private Type[] types;
    private TypeAttributes[] attributes;
    private int[] canonical;
    private Map<String, TypeRef> topLevels;
    private boolean lostTypeAttributes;

    TypeGraph() {
    }

    void freeze(
            Type[] types,
            TypeAttributes[] attributes,
            int[] canonical,
            Map<String, TypeRef> topLevels,
            boolean lostTypeAttributes
    ) {
        if (frozen) throw new IllegalStateException("Graph is already frozen");
        this.types = types;
        this.attributes = attributes;
        this.canonical = canonical;
        this.topLevels = Collections.unmodifiableMap(new LinkedHashMap<>(topLevels));
        this.lostTypeAttributes = lostTypeAttributes;
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkFrozen() {
        if (!frozen) throw new IllegalStateException("Graph is still being built");
    }

    private int checkRef(TypeRef ref) {
        checkFrozen();
        if (ref.serial != serial) {
            throw new IllegalArgumentException("Handle " + ref + " does not belong to this graph");
        }
        return canonical[ref.index];
    }

    TypeRef refAt(int index) {
        return new TypeRef(serial, index);
    }

    /**
     * Get the handle of the slot that actually holds the type {@code ref} refers to.
     *
     * @param ref The handle.
     * @return The canonical handle.
     */
    public TypeRef canonical(TypeRef ref) {
        return refAt(checkRef(ref));
    }

    public Type typeAt(TypeRef ref) {
        return types[checkRef(ref)];
    }

    public TypeAttributes attributesOf(TypeRef ref) {
        return attributes[checkRef(ref)];
    }

    public TypeAttributes attributesOf(Type type) {
        if (type.graph != this) {
            throw new IllegalArgumentException(type + " does not belong to this graph");
        }
        return attributes[type.index];
    }

    /**
     * Get the top-level types of this graph, by name.
     *
     * @return The top levels, in the order they were added.
     */
    public Map<String, Type> topLevels() {
        checkFrozen();
        Map<String, Type> ret = new LinkedHashMap<>();
        for (Map.Entry<String, TypeRef> entry : topLevels.entrySet()) {
            ret.put(entry.getKey(), typeAt(entry.getValue()));
        }
        return ret;
    }

    /**
     * Get every type in this graph, in slot order.
     *
     * @return The types.
     */
    public List<Type> allTypesUnordered() {
        checkFrozen();
        List<Type> ret = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            if (canonical[i] == i) {
                ret.add(types[i]);
            }
        }
        return ret;
    }

    /**
     * Get every type reachable from the top levels, in pre-order.
     *
     * @return The types.
     */
    public List<Type> allReachableTypes() {
        Set<Type> seen = new LinkedHashSet<>();
        for (Type root : topLevels().values()) {
            for (Type type : new GraphWalker<Type>(root, Type::getChildren).preOrder()) {
                seen.add(type);
            }
        }
        return new ArrayList<>(seen);
    }

    /**
     * Whether the rewrite that produced this graph had to drop type attributes.
     *
     * @return Whether attributes were lost.
     */
    public boolean hasLostTypeAttributes() {
        checkFrozen();
        return lostTypeAttributes;
    }

    /**
     * Rewrite this graph into a new one, replacing each group of types with
     * whatever {@code replacer} builds for it.
     * <p>
     * Types that are not in any group are carried over as they are, sharing
     * structurally identical types. Only types reachable from the top levels
     * are carried over.
     *
     * @param tag                      The name of the rewrite, for diagnostics.
     * @param stringTypeMapping        How transformed string kinds are represented in the new graph.
     * @param alphabetizeProperties    Whether class properties may be sorted.
     * @param replacementGroups        The groups of types to replace. A type can be in at most one group.
     * @param debugPrintReconstitution Whether to print the new graph.
     * @param replacer                 Builds the replacement of a group.
     * @return The new graph.
     */
    public TypeGraph rewrite(
            String tag,
            StringTypeMapping stringTypeMapping,
            boolean alphabetizeProperties,
            Collection<? extends Set<Type>> replacementGroups,
            boolean debugPrintReconstitution,
            GraphRewriteBuilder.Replacer replacer
    ) {
        checkFrozen();
        LOGGER.debug("{}: rewriting graph with {} replacement groups", tag, replacementGroups.size());
        GraphRewriteBuilder builder = new GraphRewriteBuilder(
                this,
                tag,
                stringTypeMapping,
                alphabetizeProperties,
                replacementGroups,
                replacer
        );
        TypeGraph newGraph = builder.finish();
        if (debugPrintReconstitution) {
            LOGGER.info("{}: reconstituted graph\n{}", tag, newGraph.debugPrint());
        }
        if (newGraph.lostTypeAttributes) {
            LOGGER.debug("{}: type attributes were lost", tag);
        }
        return newGraph;
    }

    /**
     * Print this graph, one type per line, in slot order.
     *
     * @return The printed graph.
     */
    public String debugPrint() {
        checkFrozen();
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, TypeRef> entry : topLevels.entrySet()) {
            sb.append("top ").append(entry.getKey()).append(": ").append(canonical(entry.getValue())).append('\n');
        }
        for (Type type : allTypesUnordered()) {
            sb.append(type.getRef()).append(' ').append(type.debugDescription());
            TypeAttributes attrs = attributes[type.index];
            if (!attrs.isEmpty()) {
                sb.append(' ').append(attrs);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TypeGraph@" + serial;
    }
}
