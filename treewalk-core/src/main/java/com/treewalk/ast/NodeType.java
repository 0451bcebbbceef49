package com.treewalk.ast;

import java.util.Set;

/**
 * Kind discriminators produced by the converter.
 *
 * <p>Kinds in the second group exist only as {@link GenericNode} types; the last group holds the
 * fallback discriminators used when a construct cannot be classified more precisely.</p>
 */
public final class NodeType {

    public static final String ARRAY_EXPRESSION = "ArrayExpression";
    public static final String ARROW_FUNCTION_EXPRESSION = "ArrowFunctionExpression";
    public static final String ASSIGNMENT_EXPRESSION = "AssignmentExpression";
    public static final String ASSIGNMENT_PATTERN = "AssignmentPattern";
    public static final String AWAIT_EXPRESSION = "AwaitExpression";
    public static final String BINARY_EXPRESSION = "BinaryExpression";
    public static final String BLOCK_STATEMENT = "BlockStatement";
    public static final String BREAK_STATEMENT = "BreakStatement";
    public static final String CALL_EXPRESSION = "CallExpression";
    public static final String CATCH_CLAUSE = "CatchClause";
    public static final String CLASS_BODY = "ClassBody";
    public static final String CLASS_DECLARATION = "ClassDeclaration";
    public static final String CLASS_EXPRESSION = "ClassExpression";
    public static final String CONDITIONAL_EXPRESSION = "ConditionalExpression";
    public static final String CONTINUE_STATEMENT = "ContinueStatement";
    public static final String DEBUGGER_STATEMENT = "DebuggerStatement";
    public static final String DECORATOR = "Decorator";
    public static final String DO_WHILE_STATEMENT = "DoWhileStatement";
    public static final String EMPTY_STATEMENT = "EmptyStatement";
    public static final String EXPORT_ALL_DECLARATION = "ExportAllDeclaration";
    public static final String EXPORT_DEFAULT_DECLARATION = "ExportDefaultDeclaration";
    public static final String EXPORT_NAMED_DECLARATION = "ExportNamedDeclaration";
    public static final String EXPORT_SPECIFIER = "ExportSpecifier";
    public static final String EXPRESSION_STATEMENT = "ExpressionStatement";
    public static final String FOR_IN_STATEMENT = "ForInStatement";
    public static final String FOR_OF_STATEMENT = "ForOfStatement";
    public static final String FOR_STATEMENT = "ForStatement";
    public static final String FUNCTION_DECLARATION = "FunctionDeclaration";
    public static final String FUNCTION_EXPRESSION = "FunctionExpression";
    public static final String IDENTIFIER = "Identifier";
    public static final String IF_STATEMENT = "IfStatement";
    public static final String IMPORT_DECLARATION = "ImportDeclaration";
    public static final String IMPORT_DEFAULT_SPECIFIER = "ImportDefaultSpecifier";
    public static final String IMPORT_EXPRESSION = "ImportExpression";
    public static final String IMPORT_NAMESPACE_SPECIFIER = "ImportNamespaceSpecifier";
    public static final String IMPORT_SPECIFIER = "ImportSpecifier";
    public static final String JSX_ATTRIBUTE = "JSXAttribute";
    public static final String JSX_CLOSING_ELEMENT = "JSXClosingElement";
    public static final String JSX_ELEMENT = "JSXElement";
    public static final String JSX_EMPTY_EXPRESSION = "JSXEmptyExpression";
    public static final String JSX_EXPRESSION_CONTAINER = "JSXExpressionContainer";
    public static final String JSX_FRAGMENT = "JSXFragment";
    public static final String JSX_IDENTIFIER = "JSXIdentifier";
    public static final String JSX_MEMBER_EXPRESSION = "JSXMemberExpression";
    public static final String JSX_OPENING_ELEMENT = "JSXOpeningElement";
    public static final String JSX_SPREAD_ATTRIBUTE = "JSXSpreadAttribute";
    public static final String JSX_SPREAD_CHILD = "JSXSpreadChild";
    public static final String JSX_TEXT = "JSXText";
    public static final String LABELED_STATEMENT = "LabeledStatement";
    public static final String LITERAL = "Literal";
    public static final String LOGICAL_EXPRESSION = "LogicalExpression";
    public static final String MEMBER_EXPRESSION = "MemberExpression";
    public static final String META_PROPERTY = "MetaProperty";
    public static final String METHOD_DEFINITION = "MethodDefinition";
    public static final String NEW_EXPRESSION = "NewExpression";
    public static final String OBJECT_EXPRESSION = "ObjectExpression";
    public static final String PRIVATE_IDENTIFIER = "PrivateIdentifier";
    public static final String PROGRAM = "Program";
    public static final String PROPERTY = "Property";
    public static final String PROPERTY_DEFINITION = "PropertyDefinition";
    public static final String REST_ELEMENT = "RestElement";
    public static final String RETURN_STATEMENT = "ReturnStatement";
    public static final String SEQUENCE_EXPRESSION = "SequenceExpression";
    public static final String SPREAD_ELEMENT = "SpreadElement";
    public static final String STATIC_BLOCK = "StaticBlock";
    public static final String SUPER = "Super";
    public static final String SWITCH_CASE = "SwitchCase";
    public static final String SWITCH_STATEMENT = "SwitchStatement";
    public static final String TS_ARRAY_TYPE = "TSArrayType";
    public static final String TS_ENUM_DECLARATION = "TSEnumDeclaration";
    public static final String TS_ENUM_MEMBER = "TSEnumMember";
    public static final String TS_INTERFACE_BODY = "TSInterfaceBody";
    public static final String TS_INTERFACE_DECLARATION = "TSInterfaceDeclaration";
    public static final String TS_INTERFACE_HERITAGE = "TSInterfaceHeritage";
    public static final String TS_INTERSECTION_TYPE = "TSIntersectionType";
    public static final String TS_METHOD_SIGNATURE = "TSMethodSignature";
    public static final String TS_PROPERTY_SIGNATURE = "TSPropertySignature";
    public static final String TS_TYPE_ALIAS_DECLARATION = "TSTypeAliasDeclaration";
    public static final String TS_TYPE_ANNOTATION = "TSTypeAnnotation";
    public static final String TS_TYPE_PARAMETER = "TSTypeParameter";
    public static final String TS_TYPE_PARAMETER_DECLARATION = "TSTypeParameterDeclaration";
    public static final String TS_TYPE_PARAMETER_INSTANTIATION = "TSTypeParameterInstantiation";
    public static final String TS_TYPE_REFERENCE = "TSTypeReference";
    public static final String TS_UNION_TYPE = "TSUnionType";
    public static final String TAGGED_TEMPLATE_EXPRESSION = "TaggedTemplateExpression";
    public static final String TEMPLATE_ELEMENT = "TemplateElement";
    public static final String TEMPLATE_LITERAL = "TemplateLiteral";
    public static final String THIS_EXPRESSION = "ThisExpression";
    public static final String THROW_STATEMENT = "ThrowStatement";
    public static final String TRY_STATEMENT = "TryStatement";
    public static final String UNARY_EXPRESSION = "UnaryExpression";
    public static final String UPDATE_EXPRESSION = "UpdateExpression";
    public static final String VARIABLE_DECLARATION = "VariableDeclaration";
    public static final String VARIABLE_DECLARATOR = "VariableDeclarator";
    public static final String WHILE_STATEMENT = "WhileStatement";
    public static final String WITH_STATEMENT = "WithStatement";
    public static final String YIELD_EXPRESSION = "YieldExpression";

    // generic-only kinds
    public static final String OBJECT_PATTERN = "ObjectPattern";
    public static final String ARRAY_PATTERN = "ArrayPattern";
    public static final String TS_STRING_KEYWORD = "TSStringKeyword";
    public static final String TS_NUMBER_KEYWORD = "TSNumberKeyword";
    public static final String TS_BOOLEAN_KEYWORD = "TSBooleanKeyword";
    public static final String TS_ANY_KEYWORD = "TSAnyKeyword";
    public static final String TS_UNKNOWN_KEYWORD = "TSUnknownKeyword";
    public static final String TS_VOID_KEYWORD = "TSVoidKeyword";
    public static final String TS_NEVER_KEYWORD = "TSNeverKeyword";
    public static final String TS_NULL_KEYWORD = "TSNullKeyword";
    public static final String TS_UNDEFINED_KEYWORD = "TSUndefinedKeyword";
    public static final String TS_OBJECT_KEYWORD = "TSObjectKeyword";
    public static final String TS_SYMBOL_KEYWORD = "TSSymbolKeyword";
    public static final String TS_BIG_INT_KEYWORD = "TSBigIntKeyword";
    public static final String TS_LITERAL_TYPE = "TSLiteralType";
    public static final String TS_TYPE_LITERAL = "TSTypeLiteral";
    public static final String TS_FUNCTION_TYPE = "TSFunctionType";
    public static final String TS_TUPLE_TYPE = "TSTupleType";
    public static final String TS_TYPE_QUERY = "TSTypeQuery";
    public static final String TS_INDEXED_ACCESS_TYPE = "TSIndexedAccessType";
    public static final String TS_CONDITIONAL_TYPE = "TSConditionalType";
    public static final String TS_TYPE_OPERATOR = "TSTypeOperator";
    public static final String TS_MAPPED_TYPE = "TSMappedType";
    public static final String TS_MODULE_DECLARATION = "TSModuleDeclaration";
    public static final String TS_AS_EXPRESSION = "TSAsExpression";
    public static final String TS_SATISFIES_EXPRESSION = "TSSatisfiesExpression";
    public static final String TS_NON_NULL_EXPRESSION = "TSNonNullExpression";
    public static final String TS_TYPE_ASSERTION = "TSTypeAssertion";
    public static final String TS_DECLARE_FUNCTION = "TSDeclareFunction";
    public static final String TS_CALL_SIGNATURE_DECLARATION = "TSCallSignatureDeclaration";
    public static final String TS_INDEX_SIGNATURE = "TSIndexSignature";
    public static final String TS_CONSTRUCT_SIGNATURE_DECLARATION = "TSConstructSignatureDeclaration";
    public static final String TS_ABSTRACT_METHOD_DEFINITION = "TSAbstractMethodDefinition";
    public static final String TS_PARENTHESIZED_TYPE = "TSParenthesizedType";
    public static final String TS_THIS_TYPE = "TSThisType";
    public static final String TS_INFER_TYPE = "TSInferType";
    public static final String TS_TEMPLATE_LITERAL_TYPE = "TSTemplateLiteralType";
    public static final String TS_TYPE_PREDICATE = "TSTypePredicate";
    public static final String TS_IMPORT_TYPE = "TSImportType";
    public static final String TS_IMPORT_EQUALS_DECLARATION = "TSImportEqualsDeclaration";
    public static final String TS_EXPORT_ASSIGNMENT = "TSExportAssignment";
    public static final String TS_NAMESPACE_EXPORT_DECLARATION = "TSNamespaceExportDeclaration";

    // fallback discriminators
    public static final String EXPRESSION = "Expression";
    public static final String STATEMENT = "Statement";
    public static final String DECLARATION = "Declaration";
    public static final String ASSIGNMENT_TARGET = "AssignmentTarget";
    public static final String UNKNOWN = "Unknown";

    public static final Set<String> ALL = Set.of(
        ARRAY_EXPRESSION, ARROW_FUNCTION_EXPRESSION, ASSIGNMENT_EXPRESSION, ASSIGNMENT_PATTERN,
        AWAIT_EXPRESSION, BINARY_EXPRESSION, BLOCK_STATEMENT, BREAK_STATEMENT, CALL_EXPRESSION,
        CATCH_CLAUSE, CLASS_BODY, CLASS_DECLARATION, CLASS_EXPRESSION, CONDITIONAL_EXPRESSION,
        CONTINUE_STATEMENT, DEBUGGER_STATEMENT, DECORATOR, DO_WHILE_STATEMENT, EMPTY_STATEMENT,
        EXPORT_ALL_DECLARATION, EXPORT_DEFAULT_DECLARATION, EXPORT_NAMED_DECLARATION,
        EXPORT_SPECIFIER, EXPRESSION_STATEMENT, FOR_IN_STATEMENT, FOR_OF_STATEMENT, FOR_STATEMENT,
        FUNCTION_DECLARATION, FUNCTION_EXPRESSION, IDENTIFIER, IF_STATEMENT, IMPORT_DECLARATION,
        IMPORT_DEFAULT_SPECIFIER, IMPORT_EXPRESSION, IMPORT_NAMESPACE_SPECIFIER, IMPORT_SPECIFIER,
        JSX_ATTRIBUTE, JSX_CLOSING_ELEMENT, JSX_ELEMENT, JSX_EMPTY_EXPRESSION,
        JSX_EXPRESSION_CONTAINER, JSX_FRAGMENT, JSX_IDENTIFIER, JSX_MEMBER_EXPRESSION,
        JSX_OPENING_ELEMENT, JSX_SPREAD_ATTRIBUTE, JSX_SPREAD_CHILD, JSX_TEXT, LABELED_STATEMENT,
        LITERAL, LOGICAL_EXPRESSION, MEMBER_EXPRESSION, META_PROPERTY, METHOD_DEFINITION,
        NEW_EXPRESSION, OBJECT_EXPRESSION, PRIVATE_IDENTIFIER, PROGRAM, PROPERTY,
        PROPERTY_DEFINITION, REST_ELEMENT, RETURN_STATEMENT, SEQUENCE_EXPRESSION, SPREAD_ELEMENT,
        STATIC_BLOCK, SUPER, SWITCH_CASE, SWITCH_STATEMENT, TS_ARRAY_TYPE, TS_ENUM_DECLARATION,
        TS_ENUM_MEMBER, TS_INTERFACE_BODY, TS_INTERFACE_DECLARATION, TS_INTERFACE_HERITAGE,
        TS_INTERSECTION_TYPE, TS_METHOD_SIGNATURE, TS_PROPERTY_SIGNATURE, TS_TYPE_ALIAS_DECLARATION,
        TS_TYPE_ANNOTATION, TS_TYPE_PARAMETER, TS_TYPE_PARAMETER_DECLARATION,
        TS_TYPE_PARAMETER_INSTANTIATION, TS_TYPE_REFERENCE, TS_UNION_TYPE,
        TAGGED_TEMPLATE_EXPRESSION, TEMPLATE_ELEMENT, TEMPLATE_LITERAL, THIS_EXPRESSION,
        THROW_STATEMENT, TRY_STATEMENT, UNARY_EXPRESSION, UPDATE_EXPRESSION, VARIABLE_DECLARATION,
        VARIABLE_DECLARATOR, WHILE_STATEMENT, WITH_STATEMENT, YIELD_EXPRESSION, OBJECT_PATTERN,
        ARRAY_PATTERN, TS_STRING_KEYWORD, TS_NUMBER_KEYWORD,
        TS_BOOLEAN_KEYWORD, TS_ANY_KEYWORD, TS_UNKNOWN_KEYWORD, TS_VOID_KEYWORD, TS_NEVER_KEYWORD,
        TS_NULL_KEYWORD, TS_UNDEFINED_KEYWORD, TS_OBJECT_KEYWORD, TS_SYMBOL_KEYWORD,
        TS_BIG_INT_KEYWORD, TS_LITERAL_TYPE, TS_TYPE_LITERAL, TS_FUNCTION_TYPE, TS_TUPLE_TYPE,
        TS_TYPE_QUERY, TS_INDEXED_ACCESS_TYPE, TS_CONDITIONAL_TYPE, TS_TYPE_OPERATOR,
        TS_MAPPED_TYPE, TS_MODULE_DECLARATION, TS_AS_EXPRESSION, TS_SATISFIES_EXPRESSION,
        TS_NON_NULL_EXPRESSION, TS_TYPE_ASSERTION, TS_DECLARE_FUNCTION,
        TS_CALL_SIGNATURE_DECLARATION, TS_INDEX_SIGNATURE, TS_CONSTRUCT_SIGNATURE_DECLARATION,
        TS_ABSTRACT_METHOD_DEFINITION, TS_PARENTHESIZED_TYPE, TS_THIS_TYPE, TS_INFER_TYPE,
        TS_TEMPLATE_LITERAL_TYPE, TS_TYPE_PREDICATE, TS_IMPORT_TYPE, TS_IMPORT_EQUALS_DECLARATION,
        TS_EXPORT_ASSIGNMENT, TS_NAMESPACE_EXPORT_DECLARATION, EXPRESSION,
        STATEMENT, DECLARATION, ASSIGNMENT_TARGET, UNKNOWN
    );

    private NodeType() {
    }

    public static boolean isKnown(String type) {
        return ALL.contains(type);
    }
}
