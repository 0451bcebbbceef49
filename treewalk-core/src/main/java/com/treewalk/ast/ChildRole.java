package com.treewalk.ast;

/**
 * Fixed catalog of named child positions read by generic traversal.
 *
 * <p>Declaration order is the tie-break order for children that start at the same offset.</p>
 */
public enum ChildRole {
    ID("id", Arity.SINGLE),
    KEY("key", Arity.SINGLE),
    VALUE("value", Arity.SINGLE),
    INIT("init", Arity.SINGLE),
    DECLARATION("declaration", Arity.SINGLE),
    TEST("test", Arity.SINGLE),
    UPDATE("update", Arity.SINGLE),
    DISCRIMINANT("discriminant", Arity.SINGLE),
    BLOCK("block", Arity.SINGLE),
    HANDLER("handler", Arity.SINGLE),
    FINALIZER("finalizer", Arity.SINGLE),
    PARAM("param", Arity.SINGLE),
    LEFT("left", Arity.SINGLE),
    RIGHT("right", Arity.SINGLE),
    EXPRESSION("expression", Arity.SINGLE),
    CALLEE("callee", Arity.SINGLE),
    OBJECT("object", Arity.SINGLE),
    PROPERTY("property", Arity.SINGLE),
    ARGUMENT("argument", Arity.SINGLE),
    QUASI("quasi", Arity.SINGLE),
    TAG("tag", Arity.SINGLE),
    SOURCE("source", Arity.SINGLE),
    LOCAL("local", Arity.SINGLE),
    IMPORTED("imported", Arity.SINGLE),
    EXPORTED("exported", Arity.SINGLE),
    LABEL("label", Arity.SINGLE),
    SUPER_CLASS("superClass", Arity.SINGLE),
    TYPE_ANNOTATION("typeAnnotation", Arity.SINGLE),
    TYPE_PARAMETERS("typeParameters", Arity.SINGLE),
    RETURN_TYPE("returnType", Arity.SINGLE),
    CONSTRAINT("constraint", Arity.SINGLE),
    DEFAULT("default", Arity.SINGLE),
    INITIALIZER("initializer", Arity.SINGLE),
    OPENING_ELEMENT("openingElement", Arity.SINGLE),
    CLOSING_ELEMENT("closingElement", Arity.SINGLE),
    NAME("name", Arity.SINGLE),
    TYPE_NAME("typeName", Arity.SINGLE),
    ELEMENT_TYPE("elementType", Arity.SINGLE),
    ALTERNATE("alternate", Arity.SINGLE),

    DECLARATIONS("declarations", Arity.LIST),
    PARAMS("params", Arity.LIST),
    CASES("cases", Arity.LIST),
    ARGUMENTS("arguments", Arity.LIST),
    PROPERTIES("properties", Arity.LIST),
    ELEMENTS("elements", Arity.LIST),
    QUASIS("quasis", Arity.LIST),
    EXPRESSIONS("expressions", Arity.LIST),
    SPECIFIERS("specifiers", Arity.LIST),
    MEMBERS("members", Arity.LIST),
    IMPLEMENTS("implements", Arity.LIST),
    CHILDREN("children", Arity.LIST),
    ATTRIBUTES("attributes", Arity.LIST),
    DECORATORS("decorators", Arity.LIST),
    TYPES("types", Arity.LIST),

    // single for some kinds, a list for others
    BODY("body", Arity.EITHER),
    CONSEQUENT("consequent", Arity.EITHER),
    EXTENDS("extends", Arity.EITHER);

    public enum Arity {
        SINGLE,
        LIST,
        EITHER
    }

    private final String fieldName;
    private final Arity arity;

    ChildRole(String fieldName, Arity arity) {
        this.fieldName = fieldName;
        this.arity = arity;
    }

    public String fieldName() {
        return fieldName;
    }

    public Arity arity() {
        return arity;
    }
}
