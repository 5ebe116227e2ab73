package io.github.typexform.attrs;

import io.github.typexform.types.StringTypes;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public class CommonAttributes {
    public static final TypeAttributeKind<Set<String>> NAMES =
            TypeAttributeKind.create(Set.class, "names", CommonAttributes::union, false);
    public static final TypeAttributeKind<Set<String>> DESCRIPTION =
            TypeAttributeKind.create(Set.class, "description", CommonAttributes::union, false);
    public static final TypeAttributeKind<StringTypes> STRING_TYPES =
            TypeAttributeKind.create(StringTypes.class, "string-types", StringTypes::union, true);

    public static TypeAttributes names(String... names) {
        return NAMES.makeAttributes(setOf(names));
    }

    public static TypeAttributes description(String... lines) {
        return DESCRIPTION.makeAttributes(setOf(lines));
    }

    private static Set<String> setOf(String... strings) {
        Set<String> set = new TreeSet<>();
        Collections.addAll(set, strings);
        return Collections.unmodifiableSet(set);
    }

    private static Set<String> union(Set<String> lhs, Set<String> rhs) {
        Set<String> set = new TreeSet<>(lhs);
        set.addAll(rhs);
        return Collections.unmodifiableSet(set);
    }
}
