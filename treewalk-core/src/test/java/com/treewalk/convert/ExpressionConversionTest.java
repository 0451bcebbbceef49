package com.treewalk.convert;

import com.treewalk.JsParser;
import com.treewalk.ParseResult;
import com.treewalk.ast.ArrayExpression;
import com.treewalk.ast.AssignmentExpression;
import com.treewalk.ast.AwaitExpression;
import com.treewalk.ast.BinaryExpression;
import com.treewalk.ast.CallExpression;
import com.treewalk.ast.ConditionalExpression;
import com.treewalk.ast.Expression;
import com.treewalk.ast.ExpressionStatement;
import com.treewalk.ast.FunctionExpression;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.ImportExpression;
import com.treewalk.ast.Literal;
import com.treewalk.ast.LogicalExpression;
import com.treewalk.ast.MemberExpression;
import com.treewalk.ast.MetaProperty;
import com.treewalk.ast.NewExpression;
import com.treewalk.ast.ObjectExpression;
import com.treewalk.ast.Property;
import com.treewalk.ast.SequenceExpression;
import com.treewalk.ast.SpreadElement;
import com.treewalk.ast.TaggedTemplateExpression;
import com.treewalk.ast.TemplateLiteral;
import com.treewalk.ast.UnaryExpression;
import com.treewalk.ast.UpdateExpression;
import com.treewalk.ast.VariableDeclaration;
import com.treewalk.ast.YieldExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionConversionTest {

    private static ParseResult parse(String source) {
        ParseResult result = JsParser.parseSource(source);
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        return result;
    }

    /**
     * The expression of a single expression statement.
     */
    private static Expression expr(String source) {
        ParseResult result = parse(source);
        return ((ExpressionStatement) result.program().body().get(0)).expression();
    }

    /**
     * The initializer of {@code const v = ...;}.
     */
    private static Expression init(String expression) {
        ParseResult result = parse("const v = " + expression + ";");
        return ((VariableDeclaration) result.program().body().get(0)).declarations().get(0).init();
    }

    @Test
    void testLiterals() {
        assertEquals("hi", ((Literal) init("'hi'")).value());
        assertEquals("a\nb", ((Literal) init("\"a\\nb\"")).value());
        assertEquals(Boolean.TRUE, ((Literal) init("true")).value());
        assertEquals(Boolean.FALSE, ((Literal) init("false")).value());

        Literal nul = (Literal) init("null");
        assertNull(nul.value());
        assertEquals("null", nul.raw());

        assertEquals(255.0, ((Literal) init("0xff")).value());
        assertEquals(1000000.0, ((Literal) init("1_000_000")).value());
        assertEquals(0.5, ((Literal) init(".5")).value());
    }

    @Test
    void testBigIntAndRegex() {
        Literal big = (Literal) init("123n");
        assertEquals(BigInteger.valueOf(123), big.value());
        assertEquals("123", big.bigint());
        assertEquals("123n", big.raw());

        Literal regex = (Literal) init("/ab+c/gi");
        assertNull(regex.value());
        assertEquals("ab+c", regex.regex().pattern());
        assertEquals("gi", regex.regex().flags());
    }

    @Test
    void testUndefinedIsIdentifier() {
        assertEquals("undefined", ((Identifier) init("undefined")).name());
    }

    @Test
    void testTemplateLiteral() {
        TemplateLiteral template = (TemplateLiteral) init("`a${x}b${y}`");
        assertEquals(3, template.quasis().size());
        assertEquals(2, template.expressions().size());
        assertEquals("a", template.quasis().get(0).value().raw());
        assertEquals("b", template.quasis().get(1).value().raw());
        assertEquals("", template.quasis().get(2).value().raw());
        assertFalse(template.quasis().get(0).tail());
        assertTrue(template.quasis().get(2).tail());

        TemplateLiteral plain = (TemplateLiteral) init("`line\\n`");
        assertEquals(1, plain.quasis().size());
        assertEquals("line\\n", plain.quasis().get(0).value().raw());
        assertEquals("line\n", plain.quasis().get(0).value().cooked());
    }

    @Test
    void testTaggedTemplate() {
        TaggedTemplateExpression tagged = (TaggedTemplateExpression) init("html`<p>${x}</p>`");
        assertEquals("html", ((Identifier) tagged.tag()).name());
        assertEquals(1, tagged.quasi().expressions().size());
    }

    @Test
    void testArraysAndObjects() {
        ArrayExpression array = (ArrayExpression) init("[1, ...rest, 'x']");
        assertEquals(3, array.elements().size());
        assertInstanceOf(SpreadElement.class, array.elements().get(1));

        ObjectExpression object = (ObjectExpression) init("{ a: 1, b, [k]: 2, m() {}, get g() { return 1; }, ...o }");
        assertEquals(6, object.properties().size());
        Property pair = (Property) object.properties().get(0);
        assertEquals("init", pair.kind());
        assertFalse(pair.shorthand());
        assertTrue(((Property) object.properties().get(1)).shorthand());
        assertTrue(((Property) object.properties().get(2)).computed());
        Property method = (Property) object.properties().get(3);
        assertTrue(method.method());
        assertInstanceOf(FunctionExpression.class, method.value());
        assertEquals("get", ((Property) object.properties().get(4)).kind());
        assertInstanceOf(SpreadElement.class, object.properties().get(5));
    }

    @Test
    void testCallsAndMembers() {
        CallExpression call = (CallExpression) expr("a.b.c(1, ...args);");
        assertEquals(2, call.arguments().size());
        MemberExpression callee = (MemberExpression) call.callee();
        assertFalse(callee.computed());
        assertEquals("c", ((Identifier) callee.property()).name());
        assertInstanceOf(MemberExpression.class, callee.object());

        MemberExpression computed = (MemberExpression) expr("a[0];");
        assertTrue(computed.computed());
        assertEquals(0.0, ((Literal) computed.property()).value());

        MemberExpression optional = (MemberExpression) expr("a?.b;");
        assertTrue(optional.optional());

        NewExpression created = (NewExpression) expr("new Foo(1);");
        assertEquals("Foo", ((Identifier) created.callee()).name());
        assertEquals(1, created.arguments().size());

        ImportExpression dynamic = (ImportExpression) expr("import('./m.js');");
        assertEquals("./m.js", ((Literal) dynamic.source()).value());
    }

    @Test
    void testOperators() {
        BinaryExpression binary = (BinaryExpression) expr("a * b;");
        assertEquals("*", binary.operator());

        LogicalExpression logical = (LogicalExpression) expr("a ?? b;");
        assertEquals("??", logical.operator());
        assertEquals("&&", ((LogicalExpression) expr("a && b;")).operator());

        UnaryExpression unary = (UnaryExpression) expr("typeof x;");
        assertEquals("typeof", unary.operator());
        assertTrue(unary.prefix());

        UpdateExpression postfix = (UpdateExpression) expr("i++;");
        assertFalse(postfix.prefix());
        assertEquals("++", postfix.operator());
        assertTrue(((UpdateExpression) expr("--i;")).prefix());

        AssignmentExpression compound = (AssignmentExpression) expr("x += 2;");
        assertEquals("+=", compound.operator());
        assertEquals("x", ((Identifier) compound.left()).name());

        AssignmentExpression destructuring = (AssignmentExpression) expr("({ a } = obj);");
        assertEquals("ObjectPattern", destructuring.left().type());

        ConditionalExpression conditional = (ConditionalExpression) expr("a ? b : c;");
        assertEquals("c", ((Identifier) conditional.alternate()).name());

        SequenceExpression sequence = (SequenceExpression) expr("a, b, c;");
        assertEquals(3, sequence.expressions().size());
    }

    @Test
    @DisplayName("Parentheses leave no node behind")
    void testParenthesesUnwrapped() {
        BinaryExpression binary = (BinaryExpression) expr("((a + b)) * c;");
        BinaryExpression left = assertInstanceOf(BinaryExpression.class, binary.left());
        assertEquals("+", left.operator());
        assertEquals(2, left.start());
        assertEquals(7, left.end());
    }

    @Test
    void testFunctionsAndGenerators() {
        FunctionExpression named = (FunctionExpression) init("async function named(a) { await a; }");
        assertTrue(named.async());
        assertEquals("named", named.id().name());
        ExpressionStatement awaited = (ExpressionStatement) named.body().body().get(0);
        assertInstanceOf(AwaitExpression.class, awaited.expression());

        FunctionExpression generator = (FunctionExpression) init("function* () { yield* other(); }");
        assertTrue(generator.generator());
        assertNull(generator.id());
        YieldExpression yielded = (YieldExpression) ((ExpressionStatement) generator.body().body().get(0)).expression();
        assertTrue(yielded.delegate());
    }

    @Test
    void testClassExpression() {
        Expression cls = init("class extends Base {}");
        assertEquals("ClassExpression", cls.type());
    }

    @Test
    void testMetaProperty() {
        ParseResult result = parse("function F() { return new.target; }");
        MetaProperty meta = (MetaProperty) result.walk().stream()
            .map(v -> v.node())
            .filter(n -> n instanceof MetaProperty)
            .findFirst()
            .orElseThrow();
        assertEquals("new", meta.meta());
        assertEquals("target", meta.property());
    }

    @Test
    @DisplayName("Long left-nested chains convert without exhausting the stack")
    void testLongConcatenationChain() {
        int operands = 50_000;
        StringBuilder source = new StringBuilder("const s = \"a\"");
        for (int i = 1; i < operands; i++) {
            source.append(i % 2 == 0 ? " + \"a\"" : " - b");
        }
        source.append(';');

        ParseResult result = parse(source.toString());
        Expression top = ((VariableDeclaration) result.program().body().get(0)).declarations().get(0).init();
        assertEquals(10, top.start());
        assertEquals(source.length() - 1, top.end());

        int depth = 0;
        Expression current = top;
        while (current instanceof BinaryExpression binary) {
            current = binary.left();
            depth++;
        }
        assertInstanceOf(Literal.class, current);
        assertEquals(operands - 1, depth);
        assertEquals(10, current.start());

        long identifiers = result.walk().stream().filter(v -> v.node() instanceof Identifier).count();
        assertEquals(operands / 2 + 1, identifiers);

        String logical = "ok = " + "a || ".repeat(operands - 1) + "a;";
        Expression chain = ((AssignmentExpression) expr(logical)).right();
        assertInstanceOf(LogicalExpression.class, chain);
        assertEquals("||", ((LogicalExpression) chain).operator());
        assertEquals(logical.length() - 1, chain.end());
    }

    @Test
    void testDeepNestingKeepsInnerNodesGeneric() {
        int levels = 3_000;
        String source = "x = " + "[".repeat(levels) + "]".repeat(levels) + ";";
        ParseResult result = JsParser.parseSource(source);
        assertTrue(result.isValid(), () -> "errors: " + result.errors());

        AssignmentExpression assignment = (AssignmentExpression) ((ExpressionStatement) result.program().body().get(0)).expression();
        assertInstanceOf(ArrayExpression.class, assignment.right());
        assertTrue(result.walk().stream()
            .map(v -> v.node())
            .anyMatch(n -> n.type().equals("Expression") && result.textOf(n).startsWith("[")));
    }
}
