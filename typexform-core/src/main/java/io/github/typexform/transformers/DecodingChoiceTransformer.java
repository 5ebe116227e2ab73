package io.github.typexform.transformers;

import io.github.typexform.types.GraphRewriteBuilder;
import io.github.typexform.types.TypeRef;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Inspects the JSON kind of a raw value at runtime, and runs the branch for that kind.
 */
public final class DecodingChoiceTransformer extends Transformer {
    /**
     * The runtime kinds of raw values, in the order their branches are listed.
     */
    public enum Branch {
        NULL("null"),
        INTEGER("integer"),
        DOUBLE("double"),
        BOOL("bool"),
        STRING("string"),
        ARRAY("array"),
        OBJECT("object"),
        ;

        public final String label;

        Branch(String label) {
            this.label = label;
        }
    }

    private final EnumMap<Branch, Transformer> branches;

    public DecodingChoiceTransformer(TypeRef sourceTypeRef, Map<Branch, Transformer> branches) {
        super("decoding-choice", sourceTypeRef);
        this.branches = new EnumMap<>(Branch.class);
        this.branches.putAll(branches);
    }

    public DecodingChoiceTransformer(
            TypeRef sourceTypeRef,
            @Nullable Transformer nullTransformer,
            @Nullable Transformer integerTransformer,
            @Nullable Transformer doubleTransformer,
            @Nullable Transformer boolTransformer,
            @Nullable Transformer stringTransformer,
            @Nullable Transformer arrayTransformer,
            @Nullable Transformer objectTransformer
    ) {
        this(sourceTypeRef, branchMap(
                nullTransformer,
                integerTransformer,
                doubleTransformer,
                boolTransformer,
                stringTransformer,
                arrayTransformer,
                objectTransformer
        ));
    }

    private static Map<Branch, Transformer> branchMap(Transformer... transformers) {
        Map<Branch, Transformer> map = new EnumMap<>(Branch.class);
        Branch[] kinds = Branch.values();
        for (int i = 0; i < kinds.length; i++) {
            if (transformers[i] != null) {
                map.put(kinds[i], transformers[i]);
            }
        }
        return map;
    }

    /**
     * Get the branch for a runtime kind.
     *
     * @param branch The kind.
     * @return The branch, or null if values of that kind are rejected.
     */
    public @Nullable Transformer getBranch(Branch branch) {
        return branches.get(branch);
    }

    public Map<Branch, Transformer> getBranches() {
        return Collections.unmodifiableMap(branches);
    }

    @Override
    public boolean canFail() {
        if (branches.size() < Branch.values().length) return true;
        for (Transformer transformer : branches.values()) {
            if (transformer.canFail()) return true;
        }
        return false;
    }

    @Override
    public List<Transformer> getChildren() {
        return new ArrayList<>(branches.values());
    }

    /**
     * {@inheritDoc}
     * <p>
     * The reverse has one alternative per branch, in branch order. Where the branches
     * instantiate a union, each alternative first matches the runtime member of the
     * union value, so encoding dispatches on what the value is, not on what it looks like.
     */
    @Override
    public Transformer reverse(TypeRef targetTypeRef, @Nullable Transformer continuation) {
        List<Transformer> reversed = new ArrayList<>();
        for (Transformer transformer : branches.values()) {
            reversed.add(transformer.reverse(targetTypeRef, continuation));
        }
        if (reversed.isEmpty()) {
            throw new IllegalStateException("Cannot reverse a decoding choice with no branches");
        }
        return new ChoiceTransformer(targetTypeRef, reversed);
    }

    @Override
    public Transformer reconstitute(GraphRewriteBuilder builder) {
        Map<Branch, Transformer> newBranches = new EnumMap<>(Branch.class);
        for (Map.Entry<Branch, Transformer> entry : branches.entrySet()) {
            newBranches.put(entry.getKey(), entry.getValue().reconstitute(builder));
        }
        return new DecodingChoiceTransformer(builder.reconstituteTypeRef(sourceTypeRef), newBranches);
    }

    @Override
    protected void debugPrint(StringBuilder sb, int indent, String label) {
        for (int i = 0; i < indent; i++) {
            sb.append("  ");
        }
        sb.append(label).append(this).append('\n');
        for (Map.Entry<Branch, Transformer> entry : branches.entrySet()) {
            entry.getValue().debugPrint(sb, indent + 1, entry.getKey().label + ": ");
        }
    }
}
