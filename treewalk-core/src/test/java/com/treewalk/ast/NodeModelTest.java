package com.treewalk.ast;

import com.treewalk.source.SourceText;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeModelTest {

    private static SourceLocation loc(int start, int end) {
        return new SourceLocation(start, end, 1, 1);
    }

    @Test
    void testChildSlotFactories() {
        assertSame(ChildSlot.EMPTY, ChildSlot.empty());
        assertSame(ChildSlot.EMPTY, ChildSlot.of((Node) null));
        assertSame(ChildSlot.EMPTY, ChildSlot.of(List.of()));
        assertTrue(ChildSlot.empty().isEmpty());

        Identifier x = new Identifier(loc(0, 1), "x");
        ChildSlot one = ChildSlot.of(x);
        assertInstanceOf(ChildSlot.One.class, one);
        assertEquals(List.of(x), one.nodes());

        ChildSlot many = ChildSlot.of(List.of(x, x));
        assertInstanceOf(ChildSlot.Many.class, many);
        assertEquals(2, many.nodes().size());
    }

    @Test
    void testManySlotIsACopy() {
        List<Identifier> items = new ArrayList<>();
        items.add(new Identifier(loc(0, 1), "a"));
        ChildSlot slot = ChildSlot.of(items);
        items.add(new Identifier(loc(2, 3), "b"));
        assertEquals(1, slot.nodes().size());
    }

    @Test
    void testChildrenSortedByStart() {
        // roles are read as test, alternate, consequent; output must follow the source
        Identifier test = new Identifier(loc(0, 1), "a");
        Identifier consequent = new Identifier(loc(4, 5), "b");
        Identifier alternate = new Identifier(loc(8, 9), "c");
        ConditionalExpression conditional = new ConditionalExpression(loc(0, 9), test, consequent, alternate);

        List<Node> children = conditional.childNodes();
        assertEquals(List.of(test, consequent, alternate), children);
    }

    @Test
    void testAbsentOptionalChildrenAreSkipped() {
        ReturnStatement bare = new ReturnStatement(loc(0, 7), null);
        assertTrue(bare.childNodes().isEmpty());
        assertTrue(bare.slot(ChildRole.ARGUMENT).isEmpty());

        IfStatement noElse = new IfStatement(loc(0, 12),
            new Identifier(loc(4, 5), "x"),
            new EmptyStatement(loc(7, 8)),
            null);
        assertEquals(2, noElse.childNodes().size());
    }

    @Test
    void testGenericNodeHasNoChildren() {
        GenericNode node = new GenericNode(NodeType.TS_LITERAL_TYPE, loc(3, 9));
        assertEquals("TSLiteralType", node.type());
        for (ChildRole role : ChildRole.values()) {
            assertTrue(node.slot(role).isEmpty(), role.name());
        }
        assertTrue(node.childNodes().isEmpty());
    }

    @Test
    void testUnrelatedRoleAnswersEmpty() {
        Identifier id = new Identifier(loc(0, 1), "x");
        assertTrue(id.slot(ChildRole.BODY).isEmpty());
        assertTrue(id.slot(ChildRole.CALLEE).isEmpty());
    }

    @Test
    void testLocationAccessors() {
        Identifier id = new Identifier(new SourceLocation(6, 9, 2, 2), "foo");
        assertEquals(6, id.span().start());
        assertEquals(9, id.span().end());
        assertEquals(new LineRange(2, 2), id.lineRange());
        assertEquals(new SourceLocation(6, 9, 2, 2), id.loc());
    }

    @Test
    void testTextOfNode() {
        String source = "let a;\nlet foo = 1;";
        Identifier id = new Identifier(new SourceLocation(11, 14, 2, 2), "foo");
        assertEquals("foo", id.text(source));
        assertEquals("foo", id.text(SourceText.of(source)));
    }

    @Test
    void testRoleArity() {
        assertEquals(ChildRole.Arity.SINGLE, ChildRole.TEST.arity());
        assertEquals(ChildRole.Arity.LIST, ChildRole.PARAMS.arity());
        assertEquals(ChildRole.Arity.EITHER, ChildRole.BODY.arity());
        assertEquals("superClass", ChildRole.SUPER_CLASS.fieldName());
    }

    @Test
    void testBodyRoleCarriesBothArities() {
        BlockStatement block = new BlockStatement(loc(0, 2), List.of(new EmptyStatement(loc(1, 2))));
        assertInstanceOf(ChildSlot.Many.class, block.slot(ChildRole.BODY));

        WhileStatement loop = new WhileStatement(loc(0, 12), new Identifier(loc(7, 8), "x"), block);
        assertInstanceOf(ChildSlot.One.class, loop.slot(ChildRole.BODY));
    }

    @Test
    void testKnownTypes() {
        assertTrue(NodeType.isKnown("Program"));
        assertTrue(NodeType.isKnown(NodeType.UNKNOWN));
        assertTrue(NodeType.isKnown("JSXElement"));
        assertFalse(NodeType.isKnown("NotAKind"));
        assertTrue(NodeType.isKnown(new IfStatement(loc(0, 1), null, null, null).type()));
    }
}
