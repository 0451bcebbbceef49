package com.treewalk.convert;

import com.treewalk.ast.BlockStatement;
import com.treewalk.ast.BreakStatement;
import com.treewalk.ast.CatchClause;
import com.treewalk.ast.ClassBody;
import com.treewalk.ast.ClassDeclaration;
import com.treewalk.ast.ClassExpression;
import com.treewalk.ast.ClassMember;
import com.treewalk.ast.ContinueStatement;
import com.treewalk.ast.DebuggerStatement;
import com.treewalk.ast.Decorator;
import com.treewalk.ast.DoWhileStatement;
import com.treewalk.ast.EmptyStatement;
import com.treewalk.ast.ExportAllDeclaration;
import com.treewalk.ast.ExportDefaultDeclaration;
import com.treewalk.ast.ExportNamedDeclaration;
import com.treewalk.ast.ExportSpecifier;
import com.treewalk.ast.Expression;
import com.treewalk.ast.ExpressionStatement;
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
import com.treewalk.ast.Literal;
import com.treewalk.ast.MethodDefinition;
import com.treewalk.ast.Node;
import com.treewalk.ast.NodeType;
import com.treewalk.ast.PropertyDefinition;
import com.treewalk.ast.ReturnStatement;
import com.treewalk.ast.SourceLocation;
import com.treewalk.ast.Statement;
import com.treewalk.ast.StaticBlock;
import com.treewalk.ast.SwitchCase;
import com.treewalk.ast.SwitchStatement;
import com.treewalk.ast.TSInterfaceHeritage;
import com.treewalk.ast.ThrowStatement;
import com.treewalk.ast.TryStatement;
import com.treewalk.ast.VariableDeclaration;
import com.treewalk.ast.VariableDeclarator;
import com.treewalk.ast.WhileStatement;
import com.treewalk.ast.WithStatement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts statements, declarations, classes and module items.
 */
final class StatementConverter {
    private static final Logger log = LogManager.getLogger(StatementConverter.class);

    private static final Set<String> DECLARATION_TYPES = Set.of(
        "function_declaration", "generator_function_declaration", "function_signature",
        "lexical_declaration", "variable_declaration", "class_declaration", "abstract_class_declaration",
        "type_alias_declaration", "interface_declaration", "enum_declaration", "module", "internal_module");

    private final ConversionContext ctx;

    StatementConverter(ConversionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Converts the statement children of a program, block or static block.
     */
    List<Statement> statementList(TSNode parent) {
        return statementList(Cst.namedChildren(parent));
    }

    List<Statement> statementList(List<TSNode> nodes) {
        List<TSNode> items = new ArrayList<>();
        for (TSNode child : nodes) {
            if (!"hash_bang_line".equals(child.getType())) {
                items.add(child);
            }
        }
        return ctx.convertAll(items, this::convert);
    }

    Statement convert(TSNode node) {
        if (ctx.tooDeep()) {
            return ctx.generic(NodeType.STATEMENT, node);
        }
        SourceLocation loc = ctx.loc(node);
        return switch (node.getType()) {
            case "expression_statement" -> new ExpressionStatement(loc,
                ctx.convert(Cst.firstNamed(node), ctx.expressions()::convert));
            case "statement_block" -> block(node);
            case "empty_statement" -> new EmptyStatement(loc);
            case "debugger_statement" -> new DebuggerStatement(loc);
            case "with_statement" -> new WithStatement(loc,
                ctx.convert(Cst.field(node, "object"), n -> ctx.generic(NodeType.EXPRESSION, Cst.unwrapParens(n))),
                ctx.convert(Cst.field(node, "body"), this::convert));
            case "return_statement" -> new ReturnStatement(loc,
                ctx.convert(Cst.firstNamed(node), ctx.expressions()::convert));
            case "throw_statement" -> new ThrowStatement(loc,
                ctx.convert(Cst.firstNamed(node), ctx.expressions()::convert));
            case "break_statement" -> new BreakStatement(loc,
                ctx.convert(Cst.field(node, "label"), ctx.expressions()::identifier));
            case "continue_statement" -> new ContinueStatement(loc,
                ctx.convert(Cst.field(node, "label"), ctx.expressions()::identifier));
            case "labeled_statement" -> new LabeledStatement(loc,
                ctx.convert(Cst.field(node, "label"), ctx.expressions()::identifier),
                ctx.convert(Cst.field(node, "body"), this::convert));
            case "if_statement" -> ifStatement(node);
            case "switch_statement" -> switchStatement(node);
            case "try_statement" -> tryStatement(node);
            case "while_statement" -> new WhileStatement(loc,
                ctx.convert(Cst.field(node, "condition"), ctx.expressions()::convert),
                ctx.convert(Cst.field(node, "body"), this::convert));
            case "do_statement" -> new DoWhileStatement(loc,
                ctx.convert(Cst.field(node, "body"), this::convert),
                ctx.convert(Cst.field(node, "condition"), ctx.expressions()::convert));
            case "for_statement" -> forStatement(node);
            case "for_in_statement" -> forInStatement(node);
            case "function_declaration", "generator_function_declaration" -> functionDeclaration(node);
            case "function_signature" -> ctx.generic(NodeType.TS_DECLARE_FUNCTION, node);
            case "lexical_declaration", "variable_declaration" -> variableDeclaration(node);
            case "class_declaration", "abstract_class_declaration" -> classDeclaration(node);
            case "import_statement" -> Cst.firstOfType(node, "import_require_clause") != null
                ? ctx.generic(NodeType.TS_IMPORT_EQUALS_DECLARATION, node)
                : importDeclaration(node);
            case "import_alias" -> ctx.generic(NodeType.TS_IMPORT_EQUALS_DECLARATION, node);
            case "export_statement" -> exportStatement(node);
            case "type_alias_declaration" -> ctx.types().typeAlias(node);
            case "interface_declaration" -> ctx.types().interfaceDeclaration(node);
            case "enum_declaration" -> ctx.types().enumDeclaration(node);
            case "ambient_declaration" -> ambient(node);
            case "module", "internal_module" -> ctx.generic(NodeType.TS_MODULE_DECLARATION, node);
            case "ERROR" -> ctx.generic(NodeType.UNKNOWN, node);
            default -> {
                log.debug("No statement kind for '{}', using generic node", node.getType());
                yield ctx.generic(NodeType.STATEMENT, node);
            }
        };
    }

    BlockStatement block(TSNode node) {
        return new BlockStatement(ctx.loc(node), statementList(node));
    }

    private IfStatement ifStatement(TSNode node) {
        TSNode alternative = Cst.field(node, "alternative");
        if (alternative != null && "else_clause".equals(alternative.getType())) {
            alternative = Cst.firstNamed(alternative);
        }
        return new IfStatement(ctx.loc(node),
            ctx.convert(Cst.field(node, "condition"), ctx.expressions()::convert),
            ctx.convert(Cst.field(node, "consequence"), this::convert),
            ctx.convert(alternative, this::convert));
    }

    private SwitchStatement switchStatement(TSNode node) {
        TSNode body = Cst.field(node, "body");
        return new SwitchStatement(ctx.loc(node),
            ctx.convert(Cst.field(node, "value"), ctx.expressions()::convert),
            ctx.convertAll(Cst.namedChildren(body), this::switchCase));
    }

    private SwitchCase switchCase(TSNode node) {
        TSNode test = "switch_case".equals(node.getType()) ? Cst.field(node, "value") : null;
        List<TSNode> consequent = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            if (test == null || child.getStartByte() != test.getStartByte() || child.getEndByte() != test.getEndByte()) {
                consequent.add(child);
            }
        }
        return new SwitchCase(ctx.loc(node),
            ctx.convert(test, ctx.expressions()::convert),
            ctx.convertAll(consequent, this::convert));
    }

    private TryStatement tryStatement(TSNode node) {
        TSNode finalizer = Cst.field(node, "finalizer");
        return new TryStatement(ctx.loc(node),
            ctx.convert(Cst.field(node, "body"), this::block),
            ctx.convert(Cst.field(node, "handler"), this::catchClause),
            ctx.convert(Cst.field(finalizer, "body"), this::block));
    }

    private CatchClause catchClause(TSNode node) {
        return new CatchClause(ctx.loc(node),
            ctx.convert(Cst.field(node, "parameter"), ctx.patterns()::catchParam),
            ctx.convert(Cst.field(node, "body"), this::block));
    }

    private ForStatement forStatement(TSNode node) {
        TSNode initializer = Cst.field(node, "initializer");
        Node init = null;
        if (initializer != null && DECLARATION_TYPES.contains(initializer.getType())) {
            init = ctx.convert(initializer, this::variableDeclaration);
        } else if (initializer != null) {
            init = ctx.convert(initializer, this::forHeadExpression);
        }
        return new ForStatement(ctx.loc(node),
            init,
            ctx.convert(Cst.field(node, "condition"), this::forHeadExpression),
            ctx.convert(Cst.field(node, "increment"), this::forHeadExpression),
            ctx.convert(Cst.field(node, "body"), this::convert));
    }

    /**
     * Expression slot of a for head; {@code ;} and empty statements mean "absent".
     */
    private Expression forHeadExpression(TSNode node) {
        if (!node.isNamed() || "empty_statement".equals(node.getType())) {
            return null;
        }
        if ("expression_statement".equals(node.getType())) {
            return ctx.convert(Cst.firstNamed(node), ctx.expressions()::convert);
        }
        return ctx.expressions().convert(node);
    }

    private Statement forInStatement(TSNode node) {
        TSNode left = Cst.field(node, "left");
        TSNode kind = Cst.field(node, "kind");
        TSNode operator = Cst.field(node, "operator");
        Node target;
        if (kind != null && left != null) {
            VariableDeclarator declarator = new VariableDeclarator(ctx.loc(left),
                ctx.convert(left, ctx.patterns()::bindingTarget), null, null);
            target = new VariableDeclaration(ctx.loc(kind, left), ctx.text(kind), List.of(declarator));
        } else {
            target = ctx.convert(left, ctx.patterns()::assignmentTarget);
        }
        Expression right = ctx.convert(Cst.field(node, "right"), ctx.expressions()::convert);
        Statement body = ctx.convert(Cst.field(node, "body"), this::convert);

        boolean isOf = operator != null ? "of".equals(ctx.text(operator)) : Cst.hasToken(node, "of");
        if (isOf) {
            return new ForOfStatement(ctx.loc(node), target, right, body, Cst.hasToken(node, "await"));
        }
        return new ForInStatement(ctx.loc(node), target, right, body);
    }

    private FunctionDeclaration functionDeclaration(TSNode node) {
        return new FunctionDeclaration(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            Cst.hasToken(node, "async"),
            Cst.hasToken(node, "*") || node.getType().startsWith("generator"),
            ctx.patterns().params(Cst.field(node, "parameters")),
            ctx.convert(Cst.field(node, "body"), this::block),
            ctx.convert(Cst.field(node, "type_parameters"), ctx.types()::typeParameters),
            ctx.convert(Cst.field(node, "return_type"), ctx.types()::typeAnnotation));
    }

    VariableDeclaration variableDeclaration(TSNode node) {
        TSNode kindNode = Cst.field(node, "kind");
        String kind = kindNode != null ? ctx.text(kindNode) : Cst.firstToken(node);
        List<TSNode> declarators = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            if ("variable_declarator".equals(child.getType())) {
                declarators.add(child);
            }
        }
        return new VariableDeclaration(ctx.loc(node), kind != null ? kind : "var",
            ctx.convertAll(declarators, this::declarator));
    }

    private VariableDeclarator declarator(TSNode node) {
        return new VariableDeclarator(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.patterns()::bindingTarget),
            ctx.convert(Cst.field(node, "value"), ctx.expressions()::convert),
            ctx.convert(Cst.field(node, "type"), ctx.types()::typeAnnotation));
    }

    private ClassDeclaration classDeclaration(TSNode node) {
        TSNode heritage = Cst.firstOfType(node, "class_heritage");
        return new ClassDeclaration(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            superClass(heritage),
            ctx.convert(Cst.field(node, "type_parameters"), ctx.types()::typeParameters),
            implementsClause(heritage),
            decorators(node),
            ctx.convert(Cst.field(node, "body"), this::classBody),
            "abstract_class_declaration".equals(node.getType()));
    }

    ClassExpression classExpression(TSNode node) {
        return new ClassExpression(ctx.loc(node),
            ctx.convert(Cst.field(node, "name"), ctx.expressions()::identifier),
            superClass(Cst.firstOfType(node, "class_heritage")),
            ctx.convert(Cst.field(node, "body"), this::classBody));
    }

    /**
     * JavaScript heritage holds the superclass expression directly; TypeScript wraps it in an
     * {@code extends_clause}.
     */
    private Expression superClass(TSNode heritage) {
        if (heritage == null) {
            return null;
        }
        TSNode extendsClause = Cst.firstOfType(heritage, "extends_clause");
        if (extendsClause != null) {
            TSNode value = Cst.field(extendsClause, "value");
            return ctx.convert(value != null ? value : Cst.firstNamed(extendsClause), ctx.expressions()::convert);
        }
        if (Cst.firstOfType(heritage, "implements_clause") != null) {
            return null;
        }
        return ctx.convert(Cst.firstNamed(heritage), ctx.expressions()::convert);
    }

    private List<TSInterfaceHeritage> implementsClause(TSNode heritage) {
        TSNode clause = heritage != null ? Cst.firstOfType(heritage, "implements_clause") : null;
        if (clause == null) {
            return List.of();
        }
        return ctx.convertAll(Cst.namedChildren(clause), ctx.types()::heritage);
    }

    private List<Decorator> decorators(TSNode node) {
        List<TSNode> decorators = new ArrayList<>();
        for (TSNode child : Cst.namedChildren(node)) {
            if ("decorator".equals(child.getType())) {
                decorators.add(child);
            }
        }
        return ctx.convertAll(decorators, d -> new Decorator(ctx.loc(d),
            ctx.convert(Cst.firstNamed(d), ctx.expressions()::convert)));
    }

    private ClassBody classBody(TSNode node) {
        return new ClassBody(ctx.loc(node), ctx.convertAll(Cst.namedChildren(node), this::classMember));
    }

    private ClassMember classMember(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        return switch (node.getType()) {
            case "method_definition" -> {
                TSNode key = Cst.field(node, "name");
                yield new MethodDefinition(loc,
                    ctx.convert(key, ctx.expressions()::propertyKey),
                    ctx.expressions().method(node),
                    ctx.expressions().methodKind(node),
                    key != null && "computed_property_name".equals(key.getType()),
                    Cst.hasToken(node, "static"),
                    decorators(node));
            }
            case "field_definition", "public_field_definition" -> {
                TSNode key = Cst.field(node, "property");
                if (key == null) {
                    key = Cst.field(node, "name");
                }
                yield new PropertyDefinition(loc,
                    ctx.convert(key, ctx.expressions()::propertyKey),
                    ctx.convert(Cst.field(node, "value"), ctx.expressions()::convert),
                    key != null && "computed_property_name".equals(key.getType()),
                    Cst.hasToken(node, "static"),
                    ctx.convert(Cst.field(node, "type"), ctx.types()::typeAnnotation),
                    decorators(node));
            }
            case "class_static_block" -> {
                TSNode body = Cst.field(node, "body");
                yield new StaticBlock(loc, statementList(body != null ? body : node));
            }
            case "abstract_method_signature" -> ctx.generic(NodeType.TS_ABSTRACT_METHOD_DEFINITION, node);
            case "method_signature" -> ctx.generic(NodeType.TS_DECLARE_FUNCTION, node);
            case "index_signature" -> ctx.generic(NodeType.TS_INDEX_SIGNATURE, node);
            default -> ctx.generic(NodeType.UNKNOWN, node);
        };
    }

    private ImportDeclaration importDeclaration(TSNode node) {
        List<Node> specifiers = new ArrayList<>();
        TSNode clause = Cst.firstOfType(node, "import_clause");
        for (TSNode child : Cst.namedChildren(clause)) {
            switch (child.getType()) {
                case "identifier" -> specifiers.add(new ImportDefaultSpecifier(ctx.loc(child),
                    ctx.expressions().identifier(child)));
                case "namespace_import" -> specifiers.add(new ImportNamespaceSpecifier(ctx.loc(child),
                    ctx.convert(Cst.firstOfType(child, "identifier"), ctx.expressions()::identifier)));
                case "named_imports" -> specifiers.addAll(
                    ctx.convertAll(Cst.namedChildren(child), this::importSpecifier));
                default -> log.debug("Skipping import clause part '{}'", child.getType());
            }
        }
        return new ImportDeclaration(ctx.loc(node), List.copyOf(specifiers),
            ctx.convert(Cst.field(node, "source"), ctx.expressions()::literal),
            Cst.hasToken(node, "type") ? "type" : "value");
    }

    private ImportSpecifier importSpecifier(TSNode node) {
        TSNode name = Cst.field(node, "name");
        TSNode alias = Cst.field(node, "alias");
        return new ImportSpecifier(ctx.loc(node),
            ctx.convert(name, ctx.expressions()::identifier),
            ctx.convert(alias != null ? alias : name, ctx.expressions()::identifier));
    }

    private Statement exportStatement(TSNode node) {
        SourceLocation loc = ctx.loc(node);
        TSNode declaration = Cst.field(node, "declaration");
        Literal source = ctx.convert(Cst.field(node, "source"), ctx.expressions()::literal);

        if (Cst.hasToken(node, "namespace")) {
            return ctx.generic(NodeType.TS_NAMESPACE_EXPORT_DECLARATION, node);
        }
        if (Cst.hasToken(node, "=")) {
            return ctx.generic(NodeType.TS_EXPORT_ASSIGNMENT, node);
        }
        if (Cst.hasToken(node, "default")) {
            Node exported = declaration != null
                ? ctx.convert(declaration, this::convert)
                : ctx.convert(Cst.field(node, "value"), ctx.expressions()::convert);
            return new ExportDefaultDeclaration(loc, exported);
        }
        if (declaration != null) {
            return new ExportNamedDeclaration(loc, ctx.convert(declaration, this::convert), List.of(), source);
        }
        TSNode namespace = Cst.firstOfType(node, "namespace_export");
        if (namespace != null || Cst.hasToken(node, "*")) {
            Identifier exported = namespace != null
                ? ctx.convert(Cst.firstNamed(namespace), ctx.expressions()::identifier)
                : null;
            return new ExportAllDeclaration(loc, exported, source);
        }
        TSNode clause = Cst.firstOfType(node, "export_clause");
        if (clause != null) {
            return new ExportNamedDeclaration(loc, null,
                ctx.convertAll(Cst.namedChildren(clause), this::exportSpecifier), source);
        }
        return ctx.generic(NodeType.STATEMENT, node);
    }

    private ExportSpecifier exportSpecifier(TSNode node) {
        TSNode name = Cst.field(node, "name");
        TSNode alias = Cst.field(node, "alias");
        return new ExportSpecifier(ctx.loc(node),
            ctx.convert(name, ctx.expressions()::identifier),
            ctx.convert(alias != null ? alias : name, ctx.expressions()::identifier));
    }

    /**
     * {@code declare ...}: the wrapped declaration, or a generic declaration when there is none.
     */
    private Statement ambient(TSNode node) {
        for (TSNode child : Cst.namedChildren(node)) {
            if (DECLARATION_TYPES.contains(child.getType())) {
                return convert(child);
            }
        }
        return ctx.generic(NodeType.DECLARATION, node);
    }
}
