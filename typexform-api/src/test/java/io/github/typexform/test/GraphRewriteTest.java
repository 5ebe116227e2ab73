package io.github.typexform.test;

import io.github.typexform.attrs.CommonAttributes;
import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.types.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphRewriteTest {
    private static TypeGraph buildPerson() {
        TypeBuilder builder = new TypeBuilder();
        TypeRef person = builder.reserveTypeRef();
        Map<String, ClassProperty> properties = new LinkedHashMap<>();
        properties.put("age", new ClassProperty(builder.getPrimitiveType(TypeKind.INTEGER, CommonAttributes.names("age")), false));
        properties.put("name", new ClassProperty(builder.getPrimitiveType(TypeKind.STRING), false));
        properties.put("friends", new ClassProperty(builder.getArrayType(TypeAttributes.EMPTY, person), true));
        builder.getClassType(CommonAttributes.names("Person"), properties, person);
        builder.addTopLevel("Person", person);
        // not reachable from any top level
        builder.getPrimitiveType(TypeKind.DOUBLE);
        return builder.finish();
    }

    private static Type findKind(TypeGraph graph, TypeKind kind) {
        for (Type type : graph.allTypesUnordered()) {
            if (type.kind == kind) return type;
        }
        throw new AssertionError("No type of kind " + kind + " in " + graph.debugPrint());
    }

    @Test
    void testIdentityRewrite() {
        TypeGraph graph = buildPerson();
        TypeGraph rewritten = graph.rewrite(
                "identity",
                StringTypeMapping.IDENTITY,
                false,
                Collections.emptyList(),
                false,
                (group, builder, forwardingRef) -> {
                    throw new AssertionError("nothing to replace");
                }
        );
        assertNotSame(graph, rewritten);
        assertFalse(rewritten.hasLostTypeAttributes());
        assertEquals(4, rewritten.allTypesUnordered().size());

        ClassType person = (ClassType) rewritten.topLevels().get("Person");
        assertEquals(Arrays.asList("age", "name", "friends"), new ArrayList<>(person.getProperties().keySet()));
        assertSame(person, ((ArrayType) person.getPropertyType("friends")).getItems());
        assertEquals(Collections.singleton("age"),
                person.getPropertyType("age").getAttributes().getOrThrow(CommonAttributes.NAMES));
    }

    @Test
    void testReplaceGroup() {
        TypeGraph graph = buildPerson();
        Type integer = findKind(graph, TypeKind.INTEGER);
        List<Set<Type>> groups = Collections.singletonList(Collections.singleton(integer));
        TypeGraph rewritten = graph.rewrite(
                "stringify-integers",
                StringTypeMapping.IDENTITY,
                false,
                groups,
                false,
                (group, builder, forwardingRef) -> {
                    assertEquals(Collections.singleton(integer), group);
                    return builder.getStringType(
                            builder.reconstituteTypeAttributes(integer.getAttributes()),
                            StringTypes.UNRESTRICTED,
                            forwardingRef
                    );
                }
        );
        ClassType person = (ClassType) rewritten.topLevels().get("Person");
        Type age = person.getPropertyType("age");
        assertEquals(TypeKind.STRING, age.kind);
        // the replacement is structurally the same as the name property, so they are shared
        assertSame(person.getPropertyType("name"), age);
        assertTrue(age.getAttributes().getAttribute(CommonAttributes.NAMES).isPresent());
    }

    @Test
    void testReplacementReferringBack() {
        TypeGraph graph = buildPerson();
        Type array = findKind(graph, TypeKind.ARRAY);
        TypeGraph rewritten = graph.rewrite(
                "arrays-to-maps",
                StringTypeMapping.IDENTITY,
                false,
                Collections.singletonList(Collections.singleton(array)),
                false,
                (group, builder, forwardingRef) -> builder.getMapType(
                        TypeAttributes.EMPTY,
                        builder.reconstituteType(((ArrayType) array).getItems()),
                        forwardingRef
                )
        );
        ClassType person = (ClassType) rewritten.topLevels().get("Person");
        MapType friends = (MapType) person.getPropertyType("friends");
        assertSame(person, friends.getValues());
    }

    @Test
    void testReplacementMustUseForwardingRef() {
        TypeGraph graph = buildPerson();
        Type integer = findKind(graph, TypeKind.INTEGER);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> graph.rewrite(
                "bad-replacer",
                StringTypeMapping.IDENTITY,
                false,
                Collections.singletonList(Collections.singleton(integer)),
                false,
                (group, builder, forwardingRef) -> builder.getPrimitiveType(TypeKind.BOOL)
        ));
        assertTrue(e.getMessage().contains("bad-replacer"));
    }

    @Test
    void testReplacerFailureHasContext() {
        TypeGraph graph = buildPerson();
        Type integer = findKind(graph, TypeKind.INTEGER);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> graph.rewrite(
                "failing",
                StringTypeMapping.IDENTITY,
                false,
                Collections.singletonList(Collections.singleton(integer)),
                false,
                (group, builder, forwardingRef) -> {
                    throw new IllegalStateException("no");
                }
        ));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().contains("failing"));
    }

    @Test
    void testGroupsAreChecked() {
        TypeGraph graph = buildPerson();
        TypeGraph other = buildPerson();
        Type foreign = findKind(other, TypeKind.INTEGER);
        Type integer = findKind(graph, TypeKind.INTEGER);
        GraphRewriteBuilder.Replacer replacer = (group, builder, forwardingRef) -> forwardingRef;
        assertThrows(IllegalArgumentException.class, () -> graph.rewrite(
                "foreign", StringTypeMapping.IDENTITY, false,
                Collections.singletonList(Collections.singleton(foreign)), false, replacer));
        assertThrows(IllegalArgumentException.class, () -> graph.rewrite(
                "twice", StringTypeMapping.IDENTITY, false,
                Arrays.asList(Collections.singleton(integer), Collections.singleton(integer)), false, replacer));
    }

    @Test
    void testLostTypeAttributes() {
        TypeGraph graph = buildPerson();
        Type integer = findKind(graph, TypeKind.INTEGER);
        TypeGraph rewritten = graph.rewrite(
                "lossy",
                StringTypeMapping.IDENTITY,
                false,
                Collections.singletonList(Collections.singleton(integer)),
                true,
                (group, builder, forwardingRef) -> {
                    builder.setLostTypeAttributes();
                    return builder.getPrimitiveType(TypeKind.INTEGER, TypeAttributes.EMPTY, forwardingRef);
                }
        );
        assertTrue(rewritten.hasLostTypeAttributes());
        ClassType person = (ClassType) rewritten.topLevels().get("Person");
        assertFalse(person.getPropertyType("age").getAttributes().getAttribute(CommonAttributes.NAMES).isPresent());
    }
}
