package io.github.typexform.types;

import org.jetbrains.annotations.Nullable;

/**
 * The kind of a {@link Type}.
 * <p>
 * Declaration order is significant: it is the order in which union members
 * are iterated, and so the order in which code for them is generated.
 */
public enum TypeKind {
    ANY("any"),
    NONE("none"),
    NULL("null"),
    BOOL("bool"),
    INTEGER("integer"),
    DOUBLE("double"),
    STRING("string"),
    DATE("date"),
    TIME("time"),
    DATE_TIME("date-time"),
    UUID("uuid"),
    URI("uri"),
    INTEGER_STRING("integer-string"),
    BOOL_STRING("bool-string"),
    ARRAY("array"),
    CLASS("class"),
    MAP("map"),
    ENUM("enum"),
    UNION("union"),
    ;

    public final String mnemonic;

    TypeKind(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Whether types of this kind have no children.
     *
     * @return Whether this is a primitive kind.
     */
    public boolean isPrimitive() {
        return ordinal() <= BOOL_STRING.ordinal();
    }

    /**
     * Whether values of this kind are represented as JSON strings,
     * either plain or as the textual encoding of something else.
     *
     * @return Whether this is a primitive string kind.
     */
    public boolean isPrimitiveString() {
        return ordinal() >= STRING.ordinal() && ordinal() <= BOOL_STRING.ordinal();
    }

    /**
     * Whether this is a primitive string kind other than plain {@link #STRING}.
     *
     * @return Whether this is a transformed string kind.
     */
    public boolean isTransformedString() {
        return isPrimitiveString() && this != STRING;
    }

    /**
     * Get the kind that a transformed string of this kind decodes to, if it is
     * the textual encoding of another primitive.
     *
     * @return The target kind, or null.
     */
    public @Nullable TypeKind transformedStringTarget() {
        switch (this) {
            case INTEGER_STRING:
                return INTEGER;
            case BOOL_STRING:
                return BOOL;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
