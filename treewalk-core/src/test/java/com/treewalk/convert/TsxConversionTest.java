package com.treewalk.convert;

import com.treewalk.JsParser;
import com.treewalk.ParseResult;
import com.treewalk.SourceType;
import com.treewalk.ast.ExpressionStatement;
import com.treewalk.ast.FunctionDeclaration;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.JSXElement;
import com.treewalk.ast.JSXIdentifier;
import com.treewalk.ast.ReturnStatement;
import com.treewalk.ast.Statement;
import com.treewalk.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TsxConversionTest {

    private static ParseResult tsx(String source) {
        ParseResult result = JsParser.parseSource(source, "tsx");
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        return result;
    }

    @Test
    void testTypesAndJsxInOneFile() {
        String source = """
            function label(count: number): string {
              return "n" + count;
            }

            function View() {
              return <p className="x">hi</p>;
            }
            """;
        ParseResult result = tsx(source);
        List<Statement> body = result.program().body();
        assertEquals(2, body.size());
        assertEquals("module", result.program().sourceType());

        FunctionDeclaration label = (FunctionDeclaration) body.get(0);
        Identifier count = (Identifier) label.params().get(0);
        assertEquals("TSNumberKeyword", count.typeAnnotation().typeAnnotation().type());
        assertEquals("TSStringKeyword", label.returnType().typeAnnotation().type());

        FunctionDeclaration view = (FunctionDeclaration) body.get(1);
        ReturnStatement ret = (ReturnStatement) view.body().body().get(0);
        JSXElement element = (JSXElement) ret.argument();
        assertEquals("p", ((JSXIdentifier) element.openingElement().name()).name());
        assertEquals(5, view.startLine());
    }

    @Test
    void testPlainTypeScript() {
        ParseResult result = tsx("let total: number = 1;\ninterface Box { size: number }");
        VariableDeclaration declaration = (VariableDeclaration) result.program().body().get(0);
        assertEquals("TSNumberKeyword", declaration.declarations().get(0).typeAnnotation().typeAnnotation().type());
        assertEquals("TSInterfaceDeclaration", result.program().body().get(1).type());
    }

    @Test
    void testPlainJsx() {
        ParseResult result = tsx("<div>{value}</div>;");
        ExpressionStatement statement = (ExpressionStatement) result.program().body().get(0);
        assertInstanceOf(JSXElement.class, statement.expression());
    }

    @Test
    void testCommentsAndErrorsAreReported() {
        ParseResult result = JsParser.parseSource("// head\nconst ok: string = 'a';\nlet = ;", "tsx");
        assertFalse(result.isValid());
        assertEquals(1, result.comments().size());
        assertEquals(" head", result.comments().get(0).text());
        assertTrue(result.errors().stream().allMatch(e -> e.span().start() >= 32));
    }

    @Test
    void testFileNameSelectsTsx() {
        ParseResult result = new JsParser().parse("const a: number = 1;", SourceType.fromFileName("Widget.tsx"));
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        assertNotNull(((VariableDeclaration) result.program().body().get(0)).declarations().get(0).typeAnnotation());
    }
}
