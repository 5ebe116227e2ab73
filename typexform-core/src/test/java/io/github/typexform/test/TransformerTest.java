package io.github.typexform.test;

import io.github.typexform.attrs.TypeAttributes;
import io.github.typexform.transformers.*;
import io.github.typexform.types.StringTypes;
import io.github.typexform.types.TypeBuilder;
import io.github.typexform.types.TypeKind;
import io.github.typexform.types.TypeRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class TransformerTest {
    private final TypeBuilder builder = new TypeBuilder();
    private final TypeRef any = builder.getPrimitiveType(TypeKind.ANY);
    private final TypeRef string = builder.getStringType(TypeAttributes.EMPTY, StringTypes.UNRESTRICTED);
    private final TypeRef integer = builder.getPrimitiveType(TypeKind.INTEGER);
    private final TypeRef bool = builder.getPrimitiveType(TypeKind.BOOL);
    private final TypeRef union = builder.getUnionType(TypeAttributes.EMPTY, Arrays.asList(integer, bool));

    @Test
    void testParseStringReverse() {
        Transformer forward = new DecodingTransformer(string, new ParseStringTransformer(string, null));
        Transformer reverse = forward.reverse(integer, null);

        StringifyTransformer stringify = (StringifyTransformer) reverse;
        assertEquals(integer, stringify.sourceTypeRef);
        EncodingTransformer encode = (EncodingTransformer) stringify.consumer;
        assertNotNull(encode);
        assertEquals(string, encode.sourceTypeRef);

        // reversing twice gives back the same tree
        assertEquals(forward.debugPrint(), reverse.reverse(string, null).debugPrint());
    }

    @Test
    void testStringMatchReverse() {
        Transformer forward = new DecodingTransformer(string, new StringMatchTransformer(
                string,
                new StringProducerTransformer(string, null, "yes"),
                "yes"
        ));
        Transformer reverse = forward.reverse(bool, null);
        StringMatchTransformer match = (StringMatchTransformer) reverse;
        assertEquals("yes", match.stringCase);
        assertEquals(bool, match.sourceTypeRef);
        StringProducerTransformer producer = (StringProducerTransformer) match.transformer;
        assertEquals("yes", producer.result);
        assertTrue(producer.consumer instanceof EncodingTransformer);
        assertTrue(forward.canFail());
        assertTrue(reverse.canFail());
    }

    @Test
    void testUnionInstantiationReverse() {
        Transformer forward = new DecodingTransformer(integer, new UnionInstantiationTransformer(integer));
        Transformer reverse = forward.reverse(union, null);
        UnionMemberMatchTransformer match = (UnionMemberMatchTransformer) reverse;
        assertEquals(union, match.sourceTypeRef);
        assertEquals(integer, match.memberTypeRef);
        assertTrue(match.transformer instanceof EncodingTransformer);
        assertEquals(integer, match.transformer.sourceTypeRef);

        Transformer again = reverse.reverse(integer, null);
        assertEquals(forward.debugPrint(), again.debugPrint());
    }

    @Test
    void testChoiceOfOneMemberCollapses() {
        Transformer forward = new DecodingTransformer(string, new ChoiceTransformer(string, Arrays.asList(
                new StringMatchTransformer(string, new StringProducerTransformer(string,
                        new UnionInstantiationTransformer(bool), "true"), "true"),
                new StringMatchTransformer(string, new StringProducerTransformer(string,
                        new UnionInstantiationTransformer(bool), "false"), "false")
        )));
        Transformer reverse = forward.reverse(union, null);
        UnionMemberMatchTransformer match = (UnionMemberMatchTransformer) reverse;
        assertEquals(bool, match.memberTypeRef);
        ChoiceTransformer choice = (ChoiceTransformer) match.transformer;
        assertEquals(bool, choice.sourceTypeRef);
        assertEquals(2, choice.transformers.size());
    }

    @Test
    void testDecodingChoiceReverse() {
        DecodingChoiceTransformer forward = new DecodingChoiceTransformer(
                any,
                null,
                new DecodingTransformer(integer, new UnionInstantiationTransformer(integer)),
                null,
                new DecodingTransformer(bool, new UnionInstantiationTransformer(bool)),
                null,
                null,
                null
        );
        assertTrue(forward.canFail());
        assertNull(forward.getBranch(DecodingChoiceTransformer.Branch.STRING));

        ChoiceTransformer reverse = (ChoiceTransformer) forward.reverse(union, null);
        assertEquals(2, reverse.transformers.size());
        assertEquals(integer, ((UnionMemberMatchTransformer) reverse.transformers.get(0)).memberTypeRef);
        assertEquals(bool, ((UnionMemberMatchTransformer) reverse.transformers.get(1)).memberTypeRef);
        assertTrue(forward.debugPrint().contains("integer: decode"));
    }

    @Test
    void testArrayReverse() {
        TypeRef anyArray = builder.getArrayType(TypeAttributes.EMPTY, any);
        TypeRef integerArray = builder.getArrayType(TypeAttributes.EMPTY, integer);
        Transformer forward = new ArrayDecodingTransformer(anyArray, null, integer, new DecodingTransformer(any, null));
        ArrayEncodingTransformer reverse = (ArrayEncodingTransformer) forward.reverse(integerArray, null);
        assertEquals(integerArray, reverse.sourceTypeRef);
        assertEquals(any, reverse.itemTargetTypeRef);
        assertEquals(integer, reverse.itemTransformer.sourceTypeRef);
        assertTrue(reverse.itemTransformer instanceof EncodingTransformer);
        assertFalse(forward.canFail());

        assertEquals(forward.debugPrint(), reverse.reverse(anyArray, null).debugPrint());
    }

    @Test
    void testMalformedReversals() {
        Transformer decode = new DecodingTransformer(string, null);
        assertThrows(IllegalStateException.class, () -> decode.reverse(string, new EncodingTransformer(string)));

        Transformer produce = new StringProducerTransformer(string, null, "x");
        assertThrows(IllegalStateException.class, () -> produce.reverse(string, null));

        Transformer match = new UnionMemberMatchTransformer(union, new EncodingTransformer(integer), integer);
        assertThrows(IllegalStateException.class, () -> match.reverse(integer, new EncodingTransformer(integer)));

        assertThrows(IllegalArgumentException.class, () -> new ChoiceTransformer(string, Collections.emptyList()));
    }

    @Test
    void testReverseIsMemoized() {
        Transformation transformation = new Transformation(
                integer,
                new DecodingTransformer(string, new ParseStringTransformer(string, null))
        );
        Transformation reverse = transformation.getReverse();
        assertSame(reverse, transformation.getReverse());
        assertEquals(integer, reverse.getSourceTypeRef());
        assertEquals(string, reverse.getTargetTypeRef());
        assertTrue(transformation.debugPrint().startsWith("transformation to " + integer));
    }
}
