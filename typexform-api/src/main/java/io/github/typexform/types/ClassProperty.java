package io.github.typexform.types;

import java.util.Objects;

/**
 * A property of a {@link ClassType}.
 */
public final class ClassProperty {
    public final TypeRef typeRef;
    public final boolean isOptional;

    public ClassProperty(TypeRef typeRef, boolean isOptional) {
        this.typeRef = typeRef;
        this.isOptional = isOptional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassProperty that = (ClassProperty) o;
        return isOptional == that.isOptional && typeRef.equals(that.typeRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeRef, isOptional);
    }
}
