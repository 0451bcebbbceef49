package com.treewalk;

import com.treewalk.ast.ArrowFunctionExpression;
import com.treewalk.ast.BinaryExpression;
import com.treewalk.ast.BlockStatement;
import com.treewalk.ast.ExpressionStatement;
import com.treewalk.ast.FunctionDeclaration;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.Literal;
import com.treewalk.ast.Node;
import com.treewalk.ast.Program;
import com.treewalk.ast.ReturnStatement;
import com.treewalk.ast.VariableDeclaration;
import com.treewalk.ast.VariableDeclarator;
import com.treewalk.ast.WithStatement;
import com.treewalk.walk.Visit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks from source text to walked nodes for the basic constructs.
 */
public class ScenarioTest {

    @Test
    @DisplayName("const x = 1; gives one declaration with one declarator on line 1")
    void testConstDeclaration() {
        ParseResult result = JsParser.parseSource("const x = 1;");
        assertTrue(result.isValid(), () -> "errors: " + result.errors());

        Program program = result.program();
        assertEquals(0, program.start());
        assertEquals(12, program.end());
        assertEquals(1, program.body().size());

        VariableDeclaration declaration = assertInstanceOf(VariableDeclaration.class, program.body().get(0));
        assertEquals("const", declaration.kind());
        assertEquals(1, declaration.declarations().size());
        assertEquals(1, declaration.startLine());
        assertEquals(1, declaration.endLine());

        VariableDeclarator declarator = declaration.declarations().get(0);
        Identifier id = assertInstanceOf(Identifier.class, declarator.id());
        assertEquals("x", id.name());
        assertEquals(6, id.start());
        assertEquals(7, id.end());

        Literal init = assertInstanceOf(Literal.class, declarator.init());
        assertEquals(1.0, init.value());
        assertEquals("1", init.raw());
        assertEquals("1", result.textOf(init));
    }

    @Test
    void testConstDeclarationWalk() {
        ParseResult result = JsParser.parseSource("const x = 1;");
        List<String> visits = result.walk().stream()
            .map(v -> v.depth() + ":" + v.node().type())
            .collect(Collectors.toList());
        assertEquals(List.of(
            "0:Program",
            "1:VariableDeclaration",
            "2:VariableDeclarator",
            "3:Identifier",
            "3:Literal"), visits);
    }

    @Test
    @DisplayName("Function declaration followed by a newline ends on line 1")
    void testFunctionDeclaration() {
        String source = "function f() { return 1; }\n";
        ParseResult result = JsParser.parseSource(source);
        assertTrue(result.isValid(), () -> "errors: " + result.errors());

        Program program = result.program();
        assertEquals(source.length(), program.end());
        assertEquals(2, program.endLine(), "the program covers the empty last line");

        FunctionDeclaration function = assertInstanceOf(FunctionDeclaration.class, program.body().get(0));
        assertEquals("f", function.id().name());
        assertEquals(1, function.startLine());
        assertEquals(1, function.endLine());
        assertFalse(function.async());
        assertFalse(function.generator());
        assertTrue(function.params().isEmpty());

        BlockStatement body = function.body();
        assertEquals(1, body.body().size());
        ReturnStatement ret = assertInstanceOf(ReturnStatement.class, body.body().get(0));
        assertEquals("return 1;", result.textOf(ret));
    }

    @Test
    @DisplayName("Comment markers inside a string are not comments")
    void testCommentInsideString() {
        String source = "const s = '// not a comment';";
        ParseResult result = JsParser.parseSource(source);
        assertTrue(result.isValid());
        assertTrue(result.comments().isEmpty(), () -> "comments: " + result.comments());

        Literal literal = (Literal) result.walk().stream()
            .map(Visit::node)
            .filter(n -> n instanceof Literal)
            .findFirst()
            .orElseThrow();
        assertEquals("// not a comment", literal.value());
        assertEquals("'// not a comment'", literal.raw());
    }

    @Test
    void testRealCommentNextToString() {
        String source = "const s = '/* no */'; // yes";
        ParseResult result = JsParser.parseSource(source);
        assertEquals(1, result.comments().size());
        Comment comment = result.comments().get(0);
        assertEquals(" yes", comment.text());
        assertTrue(comment.isLine());
        assertEquals(source.indexOf("//"), comment.span().start());
        assertEquals(source.length(), comment.span().end());
    }

    @Test
    @DisplayName("Arrow with an expression body keeps the expression, not a block")
    void testArrowExpressionBody() {
        ParseResult result = JsParser.parseSource("const f = x => x + 1;");
        assertTrue(result.isValid());

        VariableDeclaration declaration = (VariableDeclaration) result.program().body().get(0);
        ArrowFunctionExpression arrow = assertInstanceOf(ArrowFunctionExpression.class,
            declaration.declarations().get(0).init());
        assertTrue(arrow.expression());
        assertFalse(arrow.async());
        assertEquals(1, arrow.params().size());
        assertEquals("x", ((Identifier) arrow.params().get(0)).name());

        BinaryExpression body = assertInstanceOf(BinaryExpression.class, arrow.body());
        assertEquals("+", body.operator());
        assertEquals("x + 1", result.textOf(body));
    }

    @Test
    void testArrowBlockBody() {
        ParseResult result = JsParser.parseSource("const f = (a, b) => { return a; };");
        VariableDeclaration declaration = (VariableDeclaration) result.program().body().get(0);
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) declaration.declarations().get(0).init();
        assertFalse(arrow.expression());
        assertEquals(2, arrow.params().size());
        assertInstanceOf(BlockStatement.class, arrow.body());
    }

    @Test
    @DisplayName("with statements and private member access fall back without losing siblings")
    void testUnsupportedConstructs() {
        String source = "with (obj) { this.#x; }\nlet after = 2;";
        ParseResult result = JsParser.parseSource(source, "script");
        assertEquals("script", result.program().sourceType());
        assertEquals(2, result.program().body().size());

        WithStatement with = assertInstanceOf(WithStatement.class, result.program().body().get(0));
        assertEquals("Expression", with.object().type());
        assertEquals("obj", result.textOf(with.object()));

        Node privateAccess = result.walk().stream()
            .map(Visit::node)
            .filter(n -> n.type().equals("MemberExpression"))
            .findFirst()
            .orElseThrow();
        assertEquals("this.#x", result.textOf(privateAccess));
        assertTrue(privateAccess.childNodes().isEmpty());
        assertInstanceOf(ExpressionStatement.class, ((BlockStatement) with.body()).body().get(0));

        VariableDeclaration after = assertInstanceOf(VariableDeclaration.class, result.program().body().get(1));
        assertEquals(2, after.startLine());
        assertEquals("let after = 2;", result.textOf(after));
    }
}
