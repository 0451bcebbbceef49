package com.treewalk.convert;

import com.treewalk.JsParser;
import com.treewalk.ParseResult;
import com.treewalk.ast.ClassDeclaration;
import com.treewalk.ast.FunctionDeclaration;
import com.treewalk.ast.Identifier;
import com.treewalk.ast.MethodDefinition;
import com.treewalk.ast.Node;
import com.treewalk.ast.Statement;
import com.treewalk.ast.TSArrayType;
import com.treewalk.ast.TSEnumDeclaration;
import com.treewalk.ast.TSInterfaceDeclaration;
import com.treewalk.ast.TSMethodSignature;
import com.treewalk.ast.TSPropertySignature;
import com.treewalk.ast.TSTypeAliasDeclaration;
import com.treewalk.ast.TSTypeParameter;
import com.treewalk.ast.TSTypeReference;
import com.treewalk.ast.TSUnionType;
import com.treewalk.ast.VariableDeclaration;
import com.treewalk.ast.VariableDeclarator;
import com.treewalk.walk.Visit;
import com.treewalk.walk.Walker;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TypeScriptConversionTest {

    private static List<Statement> body(String source) {
        ParseResult result = JsParser.parseSource(source, "ts");
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        return result.program().body();
    }

    @Test
    void testVariableAnnotation() {
        VariableDeclaration declaration = (VariableDeclaration) body("let count: number = 0;").get(0);
        VariableDeclarator declarator = declaration.declarations().get(0);
        assertNotNull(declarator.typeAnnotation());
        assertEquals("TSNumberKeyword", declarator.typeAnnotation().typeAnnotation().type());
    }

    @Test
    void testTypedFunction() {
        FunctionDeclaration function = (FunctionDeclaration) body(
            "function pick<T extends object, K = string>(items: T[], key?: K): T | undefined { return items[0]; }").get(0);

        List<TSTypeParameter> typeParameters = function.typeParameters().params();
        assertEquals(2, typeParameters.size());
        assertEquals("T", typeParameters.get(0).name());
        assertEquals("TSObjectKeyword", typeParameters.get(0).constraint().type());
        assertEquals("K", typeParameters.get(1).name());
        assertEquals("TSStringKeyword", typeParameters.get(1).defaultType().type());

        Identifier items = (Identifier) function.params().get(0);
        assertEquals("items", items.name());
        TSArrayType arrayType = (TSArrayType) items.typeAnnotation().typeAnnotation();
        assertEquals("TSTypeReference", arrayType.elementType().type());
        assertEquals("key", ((Identifier) function.params().get(1)).name());

        TSUnionType returnType = (TSUnionType) function.returnType().typeAnnotation();
        assertEquals(2, returnType.types().size());
        assertEquals("TSUndefinedKeyword", returnType.types().get(1).type());
    }

    @Test
    void testUnionIsFlattened() {
        TSTypeAliasDeclaration alias = (TSTypeAliasDeclaration) body("type Id = string | number | boolean;").get(0);
        assertEquals("Id", alias.id().name());
        TSUnionType union = (TSUnionType) alias.typeAnnotation();
        assertEquals(List.of("TSStringKeyword", "TSNumberKeyword", "TSBooleanKeyword"),
            union.types().stream().map(Node::type).collect(Collectors.toList()));
    }

    @Test
    void testGenericReference() {
        TSTypeAliasDeclaration alias = (TSTypeAliasDeclaration) body("type M = Map<string, Array<number>>;").get(0);
        TSTypeReference map = (TSTypeReference) alias.typeAnnotation();
        assertEquals("Map", ((Identifier) map.typeName()).name());
        assertEquals(2, map.typeParameters().params().size());
        assertInstanceOf(TSTypeReference.class, map.typeParameters().params().get(1));
    }

    @Test
    void testInterface() {
        TSInterfaceDeclaration declaration = (TSInterfaceDeclaration) body(
            "interface Shape extends Base<number>, Other {\n"
                + "  readonly name: string;\n"
                + "  size?: number;\n"
                + "  area(scale: number): number;\n"
                + "  [key: string]: unknown;\n"
                + "}").get(0);
        assertEquals("Shape", declaration.id().name());
        assertEquals(2, declaration.extendsClause().size());
        assertNotNull(declaration.extendsClause().get(0).typeParameters());
        assertNull(declaration.extendsClause().get(1).typeParameters());

        assertEquals(4, declaration.body().body().size());
        TSPropertySignature name = (TSPropertySignature) declaration.body().body().get(0);
        assertTrue(name.readonly());
        assertFalse(name.optional());
        assertTrue(((TSPropertySignature) declaration.body().body().get(1)).optional());

        TSMethodSignature area = (TSMethodSignature) declaration.body().body().get(2);
        assertEquals(1, area.params().size());
        assertEquals("TSNumberKeyword", area.returnType().typeAnnotation().type());

        assertEquals("TSIndexSignature", declaration.body().body().get(3).type());
    }

    @Test
    void testEnums() {
        List<Statement> body = body("enum Color { Red, Green = 2, 'Blue' = 4 }\nconst enum Flag { On }");
        TSEnumDeclaration color = (TSEnumDeclaration) body.get(0);
        assertFalse(color.isConst());
        assertEquals(3, color.members().size());
        assertNull(color.members().get(0).initializer());
        assertEquals("Literal", color.members().get(2).id().type());
        assertTrue(((TSEnumDeclaration) body.get(1)).isConst());
    }

    @Test
    void testClassWithModifiers() {
        ClassDeclaration declaration = (ClassDeclaration) body(
            "abstract class Repo<T> extends Base implements Store<T>, Closeable {\n"
                + "  private items: T[] = [];\n"
                + "  abstract find(id: string): T;\n"
                + "  public save(item: T): void {}\n"
                + "}").get(0);
        assertTrue(declaration.isAbstract());
        assertEquals("Base", ((Identifier) declaration.superClass()).name());
        assertEquals(2, declaration.implementsClause().size());
        assertEquals(1, declaration.typeParameters().params().size());

        assertEquals(3, declaration.body().body().size());
        assertEquals("PropertyDefinition", declaration.body().body().get(0).type());
        assertEquals("TSAbstractMethodDefinition", declaration.body().body().get(1).type());
        MethodDefinition save = (MethodDefinition) declaration.body().body().get(2);
        assertEquals("save", ((Identifier) save.key()).name());
        assertEquals("TSVoidKeyword", save.value().returnType().typeAnnotation().type());
    }

    @Test
    void testExpressionFormsFallBack() {
        ParseResult result = JsParser.parseSource("const a = value as string;\nconst b = maybe!;", "typescript");
        List<String> kinds = result.walk().stream()
            .map(Visit::node)
            .map(Node::type)
            .filter(t -> t.startsWith("TS"))
            .collect(Collectors.toList());
        assertEquals(List.of("TSAsExpression", "TSNonNullExpression"), kinds);
    }

    @Test
    void testDeclarationsWithoutDedicatedKinds() {
        List<Statement> body = body("declare function f(x: number): void;\nnamespace NS { export const a = 1; }\ndeclare const g: number;");
        assertEquals("TSDeclareFunction", body.get(0).type());
        // namespaces may surface wrapped in an expression statement
        assertTrue(Walker.stream(body.get(1)).anyMatch(v -> v.node().type().equals("TSModuleDeclaration")));
        assertEquals("VariableDeclaration", body.get(2).type());
    }

    @Test
    void testModuleInteropForms() {
        String source = "import fs = require(\"fs\");\nexport as namespace Lib;\nexport = fs;\nimport { a } from \"a\";";
        ParseResult result = JsParser.parseSource(source, "typescript");
        assertTrue(result.isValid(), () -> "errors: " + result.errors());
        List<Statement> body = result.program().body();
        assertEquals(List.of("TSImportEqualsDeclaration", "TSNamespaceExportDeclaration", "TSExportAssignment",
                "ImportDeclaration"),
            body.stream().map(Node::type).collect(Collectors.toList()));
        assertEquals("import fs = require(\"fs\");", result.textOf(body.get(0)));
        assertEquals("export as namespace Lib;", result.textOf(body.get(1)));
        assertEquals(2, body.get(1).startLine());
        assertTrue(body.get(0).childNodes().isEmpty());
    }
}
