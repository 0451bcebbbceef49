package com.treewalk.convert;

import com.treewalk.JsParser;
import com.treewalk.ParseResult;
import com.treewalk.ast.BlockStatement;
import com.treewalk.ast.BreakStatement;
import com.treewalk.ast.ClassDeclaration;
import com.treewalk.ast.DoWhileStatement;
import com.treewalk.ast.ExportAllDeclaration;
import com.treewalk.ast.ExportDefaultDeclaration;
import com.treewalk.ast.ExportNamedDeclaration;
import com.treewalk.ast.ForInStatement;
import com.treewalk.ast.ForOfStatement;
import com.treewalk.ast.ForStatement;
import com.treewalk.ast.FunctionDeclaration;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.IfStatement;
import com.treewalk.ast.ImportDeclaration;
import com.treewalk.ast.ImportDefaultSpecifier;
import com.treewalk.ast.ImportNamespaceSpecifier;
import com.treewalk.ast.ImportSpecifier;
import com.treewalk.ast.LabeledStatement;
import com.treewalk.ast.MethodDefinition;
import com.treewalk.ast.PropertyDefinition;
import com.treewalk.ast.Statement;
import com.treewalk.ast.StaticBlock;
import com.treewalk.ast.SwitchStatement;
import com.treewalk.ast.ThrowStatement;
import com.treewalk.ast.TryStatement;
import com.treewalk.ast.VariableDeclaration;
import com.treewalk.ast.WhileStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatementConversionTest {

    private static List<Statement> body(String source) {
        ParseResult result = JsParser.parseSource(source);
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        return result.program().body();
    }

    private static Statement only(String source) {
        List<Statement> body = body(source);
        assertEquals(1, body.size(), () -> "body: " + body);
        return body.get(0);
    }

    @Test
    void testVariableKinds() {
        List<Statement> body = body("var a; let b = 1, c; const d = 2;");
        assertEquals(3, body.size());
        assertEquals("var", ((VariableDeclaration) body.get(0)).kind());
        VariableDeclaration let = (VariableDeclaration) body.get(1);
        assertEquals("let", let.kind());
        assertEquals(2, let.declarations().size());
        assertNull(let.declarations().get(1).init());
        assertEquals("const", ((VariableDeclaration) body.get(2)).kind());
    }

    @Test
    void testDestructuringTargetIsGeneric() {
        VariableDeclaration declaration = (VariableDeclaration) only("const { a, b } = obj;");
        assertEquals("ObjectPattern", declaration.declarations().get(0).id().type());
        assertTrue(declaration.declarations().get(0).id().childNodes().isEmpty());

        VariableDeclaration array = (VariableDeclaration) only("let [x, y] = list;");
        assertEquals("ArrayPattern", array.declarations().get(0).id().type());
    }

    @Test
    void testIfElseChain() {
        IfStatement statement = (IfStatement) only("if (a) { b(); } else if (c) d(); else e();");
        assertEquals("a", ((Identifier) statement.test()).name());
        assertInstanceOf(BlockStatement.class, statement.consequent());
        IfStatement nested = assertInstanceOf(IfStatement.class, statement.alternate());
        assertNotNull(nested.alternate());

        IfStatement noElse = (IfStatement) only("if (a) b();");
        assertNull(noElse.alternate());
    }

    @Test
    void testLoops() {
        ForStatement forStatement = (ForStatement) only("for (let i = 0; i < n; i++) {}");
        assertInstanceOf(VariableDeclaration.class, forStatement.init());
        assertEquals("BinaryExpression", forStatement.test().type());
        assertEquals("UpdateExpression", forStatement.update().type());

        ForStatement empty = (ForStatement) only("for (;;) break;");
        assertNull(empty.init());
        assertNull(empty.test());
        assertNull(empty.update());
        assertInstanceOf(BreakStatement.class, empty.body());

        ForOfStatement forOf = (ForOfStatement) only("for (const item of items) use(item);");
        VariableDeclaration left = assertInstanceOf(VariableDeclaration.class, forOf.left());
        assertEquals("const", left.kind());
        assertEquals("item", ((Identifier) left.declarations().get(0).id()).name());
        assertFalse(forOf.await());

        ForInStatement forIn = (ForInStatement) only("for (key in obj) {}");
        assertEquals("key", ((Identifier) forIn.left()).name());

        assertInstanceOf(WhileStatement.class, only("while (x) x--;"));
        DoWhileStatement doWhile = (DoWhileStatement) only("do { x++; } while (x < 3);");
        assertEquals("BinaryExpression", doWhile.test().type());
    }

    @Test
    void testForAwait() {
        List<Statement> body = body("async function f() { for await (const x of xs) {} }");
        FunctionDeclaration function = (FunctionDeclaration) body.get(0);
        assertTrue(function.async());
        ForOfStatement loop = (ForOfStatement) function.body().body().get(0);
        assertTrue(loop.await());
    }

    @Test
    void testSwitch() {
        SwitchStatement statement = (SwitchStatement) only("switch (x) { case 1: a(); break; case 2: default: b(); }");
        assertEquals("x", ((Identifier) statement.discriminant()).name());
        assertEquals(3, statement.cases().size());
        assertEquals(2, statement.cases().get(0).consequent().size());
        assertTrue(statement.cases().get(1).consequent().isEmpty());
        assertNull(statement.cases().get(2).test());
    }

    @Test
    void testTryCatchFinally() {
        TryStatement statement = (TryStatement) only("try { a(); } catch (e) { b(e); } finally { c(); }");
        assertEquals(1, statement.block().body().size());
        assertEquals("e", ((Identifier) statement.handler().param()).name());
        assertNotNull(statement.finalizer());

        TryStatement optionalBinding = (TryStatement) only("try { a(); } catch { }");
        assertNull(optionalBinding.handler().param());
        assertNull(optionalBinding.finalizer());

        TryStatement destructured = (TryStatement) only("try {} catch ({ message }) {}");
        assertEquals(PatternConverter.PLACEHOLDER, ((Identifier) destructured.handler().param()).name());
    }

    @Test
    void testLabelsAndJumps() {
        LabeledStatement labeled = (LabeledStatement) only("outer: for (;;) { break outer; }");
        assertEquals("outer", labeled.label().name());
        BlockStatement block = (BlockStatement) ((ForStatement) labeled.body()).body();
        assertEquals("outer", ((BreakStatement) block.body().get(0)).label().name());

        ThrowStatement thrown = (ThrowStatement) only("throw new Error('x');");
        assertEquals("NewExpression", thrown.argument().type());
    }

    @Test
    void testFunctionParameters() {
        FunctionDeclaration function = (FunctionDeclaration) only("function* gen(a, b = 2, ...rest) { yield a; }");
        assertTrue(function.generator());
        assertEquals(3, function.params().size());
        assertEquals("Identifier", function.params().get(0).type());
        assertEquals("AssignmentPattern", function.params().get(1).type());
        assertEquals("RestElement", function.params().get(2).type());
    }

    @Test
    void testDestructuredParameterBecomesPlaceholder() {
        FunctionDeclaration function = (FunctionDeclaration) only("function f({ a, b }, [c]) {}");
        assertEquals(2, function.params().size());
        Identifier first = (Identifier) function.params().get(0);
        assertEquals("param", first.name());
        assertEquals(11, first.start());
        assertEquals(19, first.end());
    }

    @Test
    void testClassMembers() {
        String source = "class A extends B {\n"
            + "  static count = 0;\n"
            + "  #secret;\n"
            + "  constructor(x) { super(); }\n"
            + "  get size() { return 1; }\n"
            + "  static make() {}\n"
            + "  [key]() {}\n"
            + "  static { init(); }\n"
            + "}";
        ClassDeclaration declaration = (ClassDeclaration) only(source);
        assertEquals("A", declaration.id().name());
        assertEquals("B", ((Identifier) declaration.superClass()).name());
        assertFalse(declaration.isAbstract());
        assertEquals(7, declaration.body().body().size());

        PropertyDefinition count = (PropertyDefinition) declaration.body().body().get(0);
        assertTrue(count.isStatic());
        assertEquals("count", ((Identifier) count.key()).name());

        PropertyDefinition secret = (PropertyDefinition) declaration.body().body().get(1);
        assertEquals("PrivateIdentifier", secret.key().type());
        assertNull(secret.value());

        MethodDefinition constructor = (MethodDefinition) declaration.body().body().get(2);
        assertEquals("constructor", constructor.kind());
        assertEquals(1, constructor.value().params().size());
        assertEquals("(x) { super(); }", JsParser.parseSource(source).source()
            .textOf(constructor.value().start(), constructor.value().end()));

        assertEquals("get", ((MethodDefinition) declaration.body().body().get(3)).kind());
        MethodDefinition make = (MethodDefinition) declaration.body().body().get(4);
        assertTrue(make.isStatic());
        assertEquals("method", make.kind());
        assertTrue(((MethodDefinition) declaration.body().body().get(5)).computed());
        assertInstanceOf(StaticBlock.class, declaration.body().body().get(6));
    }

    @Test
    void testImports() {
        List<Statement> body = body("import def, { a, b as c } from 'mod';\nimport * as ns from \"ns\";\nimport 'side';");
        ImportDeclaration first = (ImportDeclaration) body.get(0);
        assertEquals("mod", first.source().value());
        assertEquals(3, first.specifiers().size());
        assertInstanceOf(ImportDefaultSpecifier.class, first.specifiers().get(0));
        ImportSpecifier renamed = (ImportSpecifier) first.specifiers().get(2);
        assertEquals("b", renamed.imported().name());
        assertEquals("c", renamed.local().name());

        ImportDeclaration namespace = (ImportDeclaration) body.get(1);
        assertEquals("ns", ((ImportNamespaceSpecifier) namespace.specifiers().get(0)).local().name());

        ImportDeclaration sideEffect = (ImportDeclaration) body.get(2);
        assertTrue(sideEffect.specifiers().isEmpty());
        assertEquals("value", sideEffect.importKind());
    }

    @Test
    void testExports() {
        List<Statement> body = body("export const a = 1;\nexport { a as b };\nexport * from 'x';\nexport default function () {}");
        ExportNamedDeclaration named = (ExportNamedDeclaration) body.get(0);
        assertInstanceOf(VariableDeclaration.class, named.declaration());

        ExportNamedDeclaration clause = (ExportNamedDeclaration) body.get(1);
        assertNull(clause.declaration());
        assertEquals("b", clause.specifiers().get(0).exported().name());

        ExportAllDeclaration all = (ExportAllDeclaration) body.get(2);
        assertNull(all.exported());
        assertEquals("x", all.source().value());

        ExportDefaultDeclaration defaultExport = (ExportDefaultDeclaration) body.get(3);
        assertNotNull(defaultExport.declaration());
    }
}
