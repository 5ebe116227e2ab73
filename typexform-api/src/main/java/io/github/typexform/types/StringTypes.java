package io.github.typexform.types;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A restriction on the values of a string type.
 * <p>
 * A string type is either unrestricted, or known to only take one of a finite set of values
 * (which inference may later decide to turn into an enum).
 */
public final class StringTypes {
    public static final StringTypes UNRESTRICTED = new StringTypes(null);

    @Nullable
    private final SortedSet<String> cases;

    private StringTypes(@Nullable SortedSet<String> cases) {
        this.cases = cases;
    }

    public static StringTypes fromCases(Collection<String> cases) {
        return new StringTypes(Collections.unmodifiableSortedSet(new TreeSet<>(cases)));
    }

    public boolean isRestricted() {
        return cases != null;
    }

    /**
     * Get the cases of this restriction.
     *
     * @return The cases, or null if unrestricted.
     */
    public @Nullable SortedSet<String> getCases() {
        return cases;
    }

    public static StringTypes union(StringTypes lhs, StringTypes rhs) {
        if (lhs.cases == null || rhs.cases == null) return UNRESTRICTED;
        SortedSet<String> cases = new TreeSet<>(lhs.cases);
        cases.addAll(rhs.cases);
        return new StringTypes(Collections.unmodifiableSortedSet(cases));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(cases, ((StringTypes) o).cases);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(cases);
    }

    @Override
    public String toString() {
        return cases == null ? "unrestricted" : "cases" + cases;
    }
}
